package com.example.auth_gateway.service;

import com.example.auth_gateway.config.OidcProperties;
import com.example.auth_gateway.model.AuthRequest;
import com.example.auth_gateway.model.OidcProvider;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@Service
@RequiredArgsConstructor
public class OidcLoginService {

  private final OidcProvider provider;
  private final OidcProperties properties;
  private final NonceGenerator nonceGenerator;
  private final AuthMetrics authMetrics;

  /**
   * Starts an id_token login. Any previous session cookie is deleted and the nonce is stored in a
   * short-lived cookie so the callback can bind the returned token to this browser.
   */
  public AuthRequest prepareLogin(HttpServletRequest request, HttpServletResponse response) {
    AuthCookies.delete(response, AuthCookies.TOKEN_COOKIE);
    final AuthRequest authRequest =
        buildRedirect(provider.authorizationEndpoint(), callbackUrl(request));
    AuthCookies.set(
        response, AuthCookies.NONCE_COOKIE, authRequest.nonce(), properties.nonceCookieMaxAge());
    authMetrics.recordLogin("oidc");
    return authRequest;
  }

  public AuthRequest buildRedirect(String providerEndpoint, String returnUrl) {
    AuthUrls.parseAbsolute(providerEndpoint, "providerEndpoint");
    final String realm = AuthUrls.realmOf(returnUrl);
    final String nonce = nonceGenerator.newNonce();

    final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("response_type", "id_token");
    params.add("client_id", provider.clientId());
    params.add("redirect_uri", returnUrl);
    params.add("scope", properties.scope());
    params.add("nonce", nonce);
    return new AuthRequest(
        providerEndpoint, returnUrl, realm, nonce, AuthUrls.appendQuery(providerEndpoint, params));
  }

  // ForwardedHeaderFilter が反映した server name/port から組み立てる。scheme は常に https。
  private String callbackUrl(HttpServletRequest request) {
    return ServletUriComponentsBuilder.fromContextPath(request)
        .scheme("https")
        .replacePath(properties.callbackPath())
        .build()
        .toUriString();
  }
}
