package com.example.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.auth_gateway.config.OpenId2Properties;
import com.example.auth_gateway.model.AuthRequest;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletResponse;

class OpenId2LoginServiceTest {

  private final AuthMetrics metrics = mock(AuthMetrics.class);

  @Test
  void buildRedirectEncodesReturnToAndRealm() {
    final OpenId2LoginService service = newService("https://provider.test/openid/login", false);

    final AuthRequest authRequest =
        service.buildRedirect("https://provider.test/openid/login", "https://app.example/cb");

    assertThat(authRequest.realm()).isEqualTo("https://app.example");
    assertThat(authRequest.returnUrl()).isEqualTo("https://app.example/cb");
    assertThat(authRequest.redirectUrl())
        .startsWith("https://provider.test/openid/login?openid.ns=http%3A%2F%2Fspecs.openid.net%2Fauth%2F2.0")
        .contains("openid.mode=checkid_setup")
        .contains("openid.return_to=https%3A%2F%2Fapp.example%2Fcb&")
        .contains("openid.realm=https%3A%2F%2Fapp.example&")
        .contains(
            "openid.claimed_id=http%3A%2F%2Fspecs.openid.net%2Fauth%2F2.0%2Fidentifier_select")
        .contains("openid.ns.sreg=http%3A%2F%2Fopenid.net%2Fextensions%2Fsreg%2F1.1");
  }

  @Test
  void buildRedirectKeepsExistingEndpointQuery() {
    final OpenId2LoginService service = newService("https://provider.test/openid/login", false);

    final AuthRequest authRequest =
        service.buildRedirect("https://provider.test/openid?x=1", "https://app.example/cb");

    assertThat(authRequest.redirectUrl()).startsWith("https://provider.test/openid?x=1&openid.ns=");
  }

  @Test
  void prepareLoginEmbedsNonceInReturnToAndCookie() {
    final OpenId2LoginService service = newService("https://provider.test/openid/login", true);
    final MockHttpServletResponse response = new MockHttpServletResponse();

    final AuthRequest authRequest = service.prepareLogin(response);

    assertThat(authRequest.returnUrl())
        .isEqualTo("https://app.example/cb?auth_nonce=" + authRequest.nonce());
    assertThat(authRequest.redirectUrl())
        .contains("openid.return_to=https%3A%2F%2Fapp.example%2Fcb%3Fauth_nonce%3D" + authRequest.nonce());
    assertThat(response.getHeader("Set-Cookie"))
        .startsWith("__Host-OpenId2Nonce=" + authRequest.nonce())
        .contains("HttpOnly")
        .contains("SameSite=Strict");
    verify(metrics).recordLogin("openid2");
  }

  @Test
  void prepareLoginFailsWhenEndpointIsNotConfigured() {
    final OpenId2LoginService service = newService("", true);

    assertThatThrownBy(() -> service.prepareLogin(new MockHttpServletResponse()))
        .extracting(ex -> ((OpenIdVerificationException) ex).reason())
        .isEqualTo(OpenIdVerificationException.Reason.CONFIG);
    verify(metrics, never()).recordLogin("openid2");
  }

  private OpenId2LoginService newService(String endpoint, boolean loginCsrfProtection) {
    final OpenId2Properties properties =
        new OpenId2Properties(
            endpoint, "https://app.example/cb", loginCsrfProtection, null, null, null, null);
    return new OpenId2LoginService(properties, new NonceGenerator(), metrics);
  }
}
