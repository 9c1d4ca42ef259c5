package com.example.auth_gateway.service;

import com.example.auth_gateway.config.OidcProperties;
import com.example.auth_gateway.model.OidcProvider;
import com.example.auth_gateway.service.dto.OidcDiscoveryDocument;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Resolves the OIDC provider once at startup.
 *
 * <p>Explicitly configured endpoints win; otherwise {@code /.well-known/openid-configuration}
 * under the issuer is fetched. Any failure is reported as {@code CONFIG} so the application
 * refuses to start.
 */
public class OidcProviderDiscoveryClient {

  private static final Logger logger = LoggerFactory.getLogger(OidcProviderDiscoveryClient.class);
  private static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient discoveryRestClient;

  public OidcProviderDiscoveryClient(RestClient discoveryRestClient) {
    this.discoveryRestClient = discoveryRestClient;
  }

  public OidcProvider resolve(OidcProperties properties) {
    AuthUrls.parseAbsolute(properties.issuer(), "oidc.issuer");
    if (properties.hasExplicitEndpoints()) {
      AuthUrls.parseAbsolute(properties.authorizationEndpoint(), "oidc.authorization-endpoint");
      AuthUrls.parseAbsolute(properties.jwkSetUri(), "oidc.jwk-set-uri");
      logger.info("oidc provider configured explicitly issuer={}", properties.issuer());
      return new OidcProvider(
          properties.issuer(),
          properties.clientId(),
          properties.authorizationEndpoint(),
          properties.jwkSetUri());
    }

    final OidcDiscoveryDocument document = fetch(properties.issuer());
    if (!properties.issuer().equals(document.issuer())) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG,
          "oidc issuer mismatch",
          "issuer",
          properties.issuer(),
          document.issuer(),
          null);
    }
    AuthUrls.parseAbsolute(document.authorizationEndpoint(), "authorization_endpoint");
    AuthUrls.parseAbsolute(document.jwksUri(), "jwks_uri");
    logger.info(
        "oidc provider discovered issuer={} authorizationEndpoint={}",
        document.issuer(),
        document.authorizationEndpoint());
    return new OidcProvider(
        document.issuer(),
        properties.clientId(),
        document.authorizationEndpoint(),
        document.jwksUri());
  }

  private OidcDiscoveryDocument fetch(String issuer) {
    final String url = stripTrailingSlash(issuer) + DISCOVERY_PATH;
    final OidcDiscoveryDocument document;
    try {
      document = discoveryRestClient.get().uri(url).retrieve().body(OidcDiscoveryDocument.class);
    } catch (RestClientException ex) {
      logger.warn("oidc discovery failed url={}", url, ex);
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG, "oidc discovery failed", ex);
    }
    if (document == null) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG, "oidc discovery returned empty body");
    }
    return document;
  }

  private String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
