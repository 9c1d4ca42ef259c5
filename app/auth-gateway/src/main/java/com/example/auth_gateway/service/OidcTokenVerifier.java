package com.example.auth_gateway.service;

import com.example.auth_gateway.model.OidcClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.oidc.IdTokenClaimNames;
import org.springframework.security.oauth2.core.oidc.StandardClaimNames;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

/**
 * Verifies an id_token and extracts the verified email and the embedded nonce.
 *
 * <p>Expiry is checked at login ({@code skipExpiry=false}) and skipped when a session cookie is
 * re-read: id_tokens typically live for an hour while the session cookie lives for a year.
 */
@Service
public class OidcTokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(OidcTokenVerifier.class);

  private final IdTokenDecoder idTokenDecoder;

  public OidcTokenVerifier(IdTokenDecoder idTokenDecoder) {
    this.idTokenDecoder = idTokenDecoder;
  }

  public OidcClaims verify(String idToken, boolean skipExpiry) {
    if (idToken == null || idToken.isBlank()) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.INVALID_TOKEN, "id_token is required");
    }
    final Jwt jwt = decode(idToken, skipExpiry);

    final String email;
    final boolean emailVerified;
    try {
      email = requireEmail(jwt.getClaims().get(StandardClaimNames.EMAIL));
      emailVerified = toBoolean(jwt.getClaims().get(StandardClaimNames.EMAIL_VERIFIED));
    } catch (IllegalArgumentException ex) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CLAIMS, "claims: " + ex.getMessage(), ex);
    }
    if (!emailVerified) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.UNVERIFIED_EMAIL,
          "email not verified: " + email,
          StandardClaimNames.EMAIL_VERIFIED,
          "true",
          "false",
          null);
    }
    return new OidcClaims(email, jwt.getClaimAsString(IdTokenClaimNames.NONCE), jwt.getExpiresAt());
  }

  private Jwt decode(String idToken, boolean skipExpiry) {
    try {
      return idTokenDecoder.decode(idToken, skipExpiry);
    } catch (BadJwtException ex) {
      logger.debug("id_token rejected: {}", ex.getMessage());
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.INVALID_TOKEN, "invalid id_token", ex);
    } catch (JwtException ex) {
      logger.warn("id_token verification could not complete", ex);
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
          "id_token verification failed",
          ex);
    }
  }

  private String requireEmail(Object value) {
    if (!(value instanceof String email) || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    return email;
  }

  // プロバイダによっては email_verified を文字列で返す。
  private boolean toBoolean(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof String text) {
      if ("true".equalsIgnoreCase(text)) {
        return true;
      }
      if ("false".equalsIgnoreCase(text)) {
        return false;
      }
    }
    throw new IllegalArgumentException("email_verified must be a boolean");
  }
}
