package com.example.auth_gateway.service;

import com.example.auth_gateway.model.OidcClaims;
import com.example.auth_gateway.model.VerifiedIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OidcCallbackService {

  private static final Logger logger = LoggerFactory.getLogger(OidcCallbackService.class);

  private final OidcTokenVerifier tokenVerifier;
  private final SessionService sessionService;
  private final Clock clock;

  /**
   * Completes the login: verifies the posted id_token, binds it to the nonce cookie set when the
   * login started, then replaces the nonce cookie with the session cookie.
   */
  public VerifiedIdentity complete(
      String idToken, HttpServletRequest request, HttpServletResponse response) {
    final OidcClaims claims = tokenVerifier.verify(idToken, false);

    final Optional<String> expectedNonce = AuthCookies.read(request, AuthCookies.NONCE_COOKIE);
    if (expectedNonce.isEmpty() || !expectedNonce.get().equals(claims.nonce())) {
      throw OpenIdVerificationException.mismatch(
          OpenIdVerificationException.Reason.NONCE_MISMATCH,
          "nonce",
          expectedNonce.orElse(null),
          claims.nonce());
    }

    AuthCookies.delete(response, AuthCookies.NONCE_COOKIE);
    sessionService.store(response, idToken);
    logger.info("oidc login completed email={}", claims.email());
    return new VerifiedIdentity(claims.email(), Instant.now(clock), claims.expiresAt());
  }
}
