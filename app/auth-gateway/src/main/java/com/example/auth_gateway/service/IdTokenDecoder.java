/*
 * どこで: auth-gateway サービス層
 * 何を: 署名付き id_token を JWKS で検証し、issuer/audience/期限を確認する
 * なぜ: 期限チェックだけをログイン時とセッション読込時で切り替えるため
 */
package com.example.auth_gateway.service;

import com.example.auth_gateway.model.OidcProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

public class IdTokenDecoder {

  private static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

  private final JwtDecoder signatureDecoder;
  private final OAuth2TokenValidator<Jwt> claimsValidator;
  private final OAuth2TokenValidator<Jwt> claimsAndExpiryValidator;

  /**
   * @param signatureDecoder decoder that checks the signature only; claim validation is done here
   */
  public IdTokenDecoder(JwtDecoder signatureDecoder, OidcProvider provider, Clock clock) {
    this.signatureDecoder = signatureDecoder;
    this.claimsValidator =
        new DelegatingOAuth2TokenValidator<>(
            new JwtIssuerValidator(provider.issuer()), audienceValidator(provider.clientId()));
    final JwtTimestampValidator timestampValidator = new JwtTimestampValidator(CLOCK_SKEW);
    timestampValidator.setClock(clock);
    this.claimsAndExpiryValidator =
        new DelegatingOAuth2TokenValidator<>(claimsValidator, timestampValidator);
  }

  public static IdTokenDecoder forProvider(OidcProvider provider, Clock clock) {
    final NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(provider.jwkSetUri()).build();
    decoder.setJwtValidator(jwt -> OAuth2TokenValidatorResult.success());
    return new IdTokenDecoder(decoder, provider, clock);
  }

  /**
   * Decodes and validates the token.
   *
   * @throws JwtValidationException when issuer, audience or (unless skipped) expiry is wrong
   * @throws JwtException when the token cannot be decoded or the key set cannot be fetched
   */
  public Jwt decode(String token, boolean skipExpiry) {
    final Jwt jwt = signatureDecoder.decode(token);
    final OAuth2TokenValidatorResult result =
        skipExpiry ? claimsValidator.validate(jwt) : claimsAndExpiryValidator.validate(jwt);
    if (result.hasErrors()) {
      final String description = result.getErrors().iterator().next().getDescription();
      throw new JwtValidationException(description, result.getErrors());
    }
    return jwt;
  }

  private static OAuth2TokenValidator<Jwt> audienceValidator(String clientId) {
    return jwt -> {
      final List<String> audience = jwt.getAudience();
      if (audience != null && audience.contains(clientId)) {
        return OAuth2TokenValidatorResult.success();
      }
      return OAuth2TokenValidatorResult.failure(
          new OAuth2Error(
              OAuth2ErrorCodes.INVALID_TOKEN, "The aud claim does not contain " + clientId, null));
    };
  }
}
