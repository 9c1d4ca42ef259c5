package com.example.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.auth_gateway.config.OidcProperties;
import com.example.auth_gateway.model.OidcProvider;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class OidcProviderDiscoveryClientTest {

  private static final String DISCOVERY_URL =
      "https://accounts.example/.well-known/openid-configuration";

  @Test
  void explicitEndpointsSkipDiscovery() {
    final ClientFixture fixture = newFixture();

    final OidcProvider provider =
        fixture.client.resolve(
            properties(
                "https://accounts.example",
                "https://accounts.example/auth",
                "https://accounts.example/certs"));

    assertThat(provider.authorizationEndpoint()).isEqualTo("https://accounts.example/auth");
    assertThat(provider.jwkSetUri()).isEqualTo("https://accounts.example/certs");
    fixture.server.verify();
  }

  @Test
  void discoveryDocumentIsFetchedUnderIssuer() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(DISCOVERY_URL))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"issuer":"https://accounts.example",
                 "authorization_endpoint":"https://accounts.example/o/oauth2/v2/auth",
                 "jwks_uri":"https://accounts.example/oauth2/v3/certs",
                 "response_types_supported":["id_token"]}
                """,
                MediaType.APPLICATION_JSON));

    final OidcProvider provider = fixture.client.resolve(properties("https://accounts.example/", null, null));

    assertThat(provider.issuer()).isEqualTo("https://accounts.example");
    assertThat(provider.clientId()).isEqualTo("client-1");
    assertThat(provider.authorizationEndpoint())
        .isEqualTo("https://accounts.example/o/oauth2/v2/auth");
    assertThat(provider.jwkSetUri()).isEqualTo("https://accounts.example/oauth2/v3/certs");
  }

  @Test
  void issuerMismatchIsConfigError() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(DISCOVERY_URL))
        .andRespond(
            withSuccess(
                """
                {"issuer":"https://evil.example",
                 "authorization_endpoint":"https://evil.example/auth",
                 "jwks_uri":"https://evil.example/certs"}
                """,
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.resolve(properties("https://accounts.example", null, null)))
        .isInstanceOf(OpenIdVerificationException.class)
        .satisfies(
            ex -> {
              final OpenIdVerificationException e = (OpenIdVerificationException) ex;
              assertThat(e.reason()).isEqualTo(OpenIdVerificationException.Reason.CONFIG);
              assertThat(e.field()).isEqualTo("issuer");
              assertThat(e.actual()).isEqualTo("https://evil.example");
            });
  }

  @Test
  void unreachableDiscoveryIsConfigError() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(DISCOVERY_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.resolve(properties("https://accounts.example", null, null)))
        .extracting(ex -> ((OpenIdVerificationException) ex).reason())
        .isEqualTo(OpenIdVerificationException.Reason.CONFIG);
  }

  @Test
  void relativeIssuerIsConfigError() {
    final ClientFixture fixture = newFixture();

    assertThatThrownBy(() -> fixture.client.resolve(properties("accounts.example", null, null)))
        .extracting(ex -> ((OpenIdVerificationException) ex).reason())
        .isEqualTo(OpenIdVerificationException.Reason.CONFIG);
  }

  private static OidcProperties properties(
      String issuer, String authorizationEndpoint, String jwkSetUri) {
    return new OidcProperties(
        issuer, "client-1", authorizationEndpoint, jwkSetUri, null, null, null, null, null);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    return new ClientFixture(new OidcProviderDiscoveryClient(builder.build()), server);
  }

  private record ClientFixture(OidcProviderDiscoveryClient client, MockRestServiceServer server) {}
}
