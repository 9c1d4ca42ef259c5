/*
 * どこで: auth-gateway 設定
 * 何を: OIDC (id_token フロー) のプロバイダ/cookie 設定を保持する
 * なぜ: issuer や cookie 寿命を環境ごとに切り替えるため
 */
package com.example.auth_gateway.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "oidc")
@Validated
public record OidcProperties(
    @NotBlank String issuer,
    @NotBlank String clientId,
    String authorizationEndpoint,
    String jwkSetUri,
    String scope,
    String callbackPath,
    String homePath,
    Duration nonceCookieMaxAge,
    Duration sessionCookieMaxAge) {

  public OidcProperties {
    authorizationEndpoint = authorizationEndpoint == null ? "" : authorizationEndpoint;
    jwkSetUri = jwkSetUri == null ? "" : jwkSetUri;
    scope = scope == null || scope.isBlank() ? "email" : scope;
    callbackPath = callbackPath == null || callbackPath.isBlank() ? "/auth/callback" : callbackPath;
    homePath = homePath == null || homePath.isBlank() ? "/" : homePath;
    nonceCookieMaxAge = nonceCookieMaxAge == null ? Duration.ofHours(1) : nonceCookieMaxAge;
    sessionCookieMaxAge =
        sessionCookieMaxAge == null ? Duration.ofDays(365) : sessionCookieMaxAge;
  }

  /** Discovery is skipped when both endpoints are configured explicitly. */
  public boolean hasExplicitEndpoints() {
    return !authorizationEndpoint.isBlank() && !jwkSetUri.isBlank();
  }

  @AssertTrue(message = "oidc.nonce-cookie-max-age must be positive")
  public boolean isNonceCookieMaxAgePositive() {
    return isPositiveDuration(nonceCookieMaxAge);
  }

  @AssertTrue(message = "oidc.session-cookie-max-age must be positive")
  public boolean isSessionCookieMaxAgePositive() {
    return isPositiveDuration(sessionCookieMaxAge);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
