package com.example.auth_gateway.service;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

/**
 * Writes and reads the authentication cookies.
 *
 * <p>Every cookie is {@code Secure}, {@code HttpOnly}, {@code SameSite=Strict} and scoped to
 * {@code /}, as required by the {@code __Host-} prefix.
 */
public final class AuthCookies {

  public static final String NONCE_COOKIE = "__Host-AuthNonce";
  public static final String TOKEN_COOKIE = "__Host-AuthToken";
  public static final String OPENID2_NONCE_COOKIE = "__Host-OpenId2Nonce";

  private AuthCookies() {}

  public static ResponseCookie build(String name, String value, Duration maxAge) {
    return ResponseCookie.from(name, value)
        .path("/")
        .maxAge(maxAge)
        .secure(true)
        .httpOnly(true)
        .sameSite("Strict")
        .build();
  }

  public static void set(HttpServletResponse response, String name, String value, Duration maxAge) {
    response.addHeader(HttpHeaders.SET_COOKIE, build(name, value, maxAge).toString());
  }

  // Max-Age=0 はブラウザ側で即時削除される。
  public static void delete(HttpServletResponse response, String name) {
    set(response, name, "", Duration.ZERO);
  }

  public static Optional<String> read(HttpServletRequest request, String name) {
    final Cookie cookie = WebUtils.getCookie(request, name);
    if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(cookie.getValue());
  }
}
