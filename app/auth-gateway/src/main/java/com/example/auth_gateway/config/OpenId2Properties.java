/*
 * どこで: auth-gateway 設定
 * 何を: OpenID 2.0 (署名付きリダイレクト) フローの設定を保持する
 * なぜ: endpoint/return_to と再検証リクエストのタイムアウトを外部化するため
 */
package com.example.auth_gateway.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "openid2")
@Validated
public record OpenId2Properties(
    String endpoint,
    String returnTo,
    Boolean loginCsrfProtection,
    Duration connectTimeout,
    Duration readTimeout,
    Duration nonceMaxAge,
    Duration nonceCookieMaxAge) {

  public OpenId2Properties {
    endpoint = endpoint == null ? "" : endpoint;
    returnTo = returnTo == null ? "" : returnTo;
    loginCsrfProtection = loginCsrfProtection == null || loginCsrfProtection;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    nonceMaxAge = nonceMaxAge == null ? Duration.ofSeconds(60) : nonceMaxAge;
    nonceCookieMaxAge = nonceCookieMaxAge == null ? Duration.ofHours(1) : nonceCookieMaxAge;
  }

  public boolean enabled() {
    return !endpoint.isBlank() && !returnTo.isBlank();
  }

  @AssertTrue(message = "openid2.connect-timeout must be positive")
  public boolean isConnectTimeoutPositive() {
    return isPositiveDuration(connectTimeout);
  }

  @AssertTrue(message = "openid2.read-timeout must be positive")
  public boolean isReadTimeoutPositive() {
    return isPositiveDuration(readTimeout);
  }

  @AssertTrue(message = "openid2.nonce-max-age must be positive")
  public boolean isNonceMaxAgePositive() {
    return isPositiveDuration(nonceMaxAge);
  }

  @AssertTrue(message = "openid2.nonce-cookie-max-age must be positive")
  public boolean isNonceCookieMaxAgePositive() {
    return isPositiveDuration(nonceCookieMaxAge);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
