package com.example.auth_gateway.service;

import com.example.auth_gateway.config.OidcProperties;
import com.example.auth_gateway.model.OidcClaims;
import com.example.auth_gateway.model.VerifiedIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

// セッションはサーバー側に保持せず、cookie 内の id_token を毎回再検証する。
@Service
@RequiredArgsConstructor
public class SessionService {

  private final OidcTokenVerifier tokenVerifier;
  private final OidcProperties properties;
  private final Clock clock;

  public void store(HttpServletResponse response, String idToken) {
    AuthCookies.set(response, AuthCookies.TOKEN_COOKIE, idToken, properties.sessionCookieMaxAge());
  }

  /**
   * Loads the identity held by the session cookie.
   *
   * <p>Expiry is not re-checked here; it was enforced once at login.
   */
  public VerifiedIdentity load(HttpServletRequest request) {
    final String idToken =
        AuthCookies.read(request, AuthCookies.TOKEN_COOKIE)
            .orElseThrow(
                () ->
                    new OpenIdVerificationException(
                        OpenIdVerificationException.Reason.NO_SESSION, "no auth token cookie"));
    final OidcClaims claims;
    try {
      claims = tokenVerifier.verify(idToken, true);
    } catch (OpenIdVerificationException ex) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.INVALID_SESSION,
          "invalid session: " + ex.getMessage(),
          ex);
    }
    return new VerifiedIdentity(claims.email(), Instant.now(clock), claims.expiresAt());
  }

  public void clear(HttpServletResponse response) {
    AuthCookies.delete(response, AuthCookies.TOKEN_COOKIE);
  }
}
