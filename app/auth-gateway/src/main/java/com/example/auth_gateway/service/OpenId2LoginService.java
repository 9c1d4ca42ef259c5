package com.example.auth_gateway.service;

import com.example.auth_gateway.config.OpenId2Properties;
import com.example.auth_gateway.model.AuthRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

// OpenID 2.0 の checkid_setup リダイレクトを組み立てる。
@Service
@RequiredArgsConstructor
public class OpenId2LoginService {

  public static final String NS = "http://specs.openid.net/auth/2.0";
  public static final String IDENTIFIER_SELECT = "http://specs.openid.net/auth/2.0/identifier_select";
  public static final String SREG_NS = "http://openid.net/extensions/sreg/1.1";
  public static final String NONCE_PARAM = "auth_nonce";

  private final OpenId2Properties properties;
  private final NonceGenerator nonceGenerator;
  private final AuthMetrics authMetrics;

  public AuthRequest prepareLogin(HttpServletResponse response) {
    if (!properties.enabled()) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG, "openid2 endpoint is not configured");
    }
    final AuthRequest authRequest = buildRedirect(properties.endpoint(), properties.returnTo());
    if (properties.loginCsrfProtection()) {
      AuthCookies.set(
          response,
          AuthCookies.OPENID2_NONCE_COOKIE,
          authRequest.nonce(),
          properties.nonceCookieMaxAge());
    }
    authMetrics.recordLogin("openid2");
    return authRequest;
  }

  /**
   * Builds the provider redirect. With login CSRF protection on, the nonce travels inside
   * {@code return_to}, so the provider echoes it back and the return URL check enforces it.
   */
  public AuthRequest buildRedirect(String providerEndpoint, String returnUrl) {
    AuthUrls.parseAbsolute(providerEndpoint, "providerEndpoint");
    final String realm = AuthUrls.realmOf(returnUrl);
    final String nonce = nonceGenerator.newNonce();
    final String returnTo = properties.loginCsrfProtection() ? withNonce(returnUrl, nonce) : returnUrl;

    final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("openid.ns", NS);
    params.add("openid.mode", "checkid_setup");
    params.add("openid.return_to", returnTo);
    params.add("openid.realm", realm);
    params.add("openid.claimed_id", IDENTIFIER_SELECT);
    params.add("openid.identity", IDENTIFIER_SELECT);
    params.add("openid.ns.sreg", SREG_NS);
    return new AuthRequest(
        providerEndpoint, returnTo, realm, nonce, AuthUrls.appendQuery(providerEndpoint, params));
  }

  private String withNonce(String returnUrl, String nonce) {
    final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add(NONCE_PARAM, nonce);
    return AuthUrls.appendQuery(returnUrl, params);
  }
}
