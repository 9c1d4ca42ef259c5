package com.example.auth_gateway.config;

import com.example.auth_gateway.model.VerifiedIdentity;
import com.example.auth_gateway.service.OpenIdVerificationException;
import com.example.auth_gateway.service.SessionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the request from the session cookie.
 *
 * <p>A missing or invalid cookie leaves the request anonymous; the entry point then sends the
 * browser back through the login.
 */
public class SessionCookieAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(SessionCookieAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";

  private final SessionService sessionService;

  public SessionCookieAuthenticationFilter(SessionService sessionService) {
    this.sessionService = sessionService;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (SecurityContextHolder.getContext().getAuthentication() == null) {
      authenticate(request);
    }
    filterChain.doFilter(request, response);
  }

  private void authenticate(HttpServletRequest request) {
    final VerifiedIdentity identity;
    try {
      identity = sessionService.load(request);
    } catch (OpenIdVerificationException ex) {
      // セッション無しは再ログインの通常経路なのでエラーとして扱わない。
      logger.debug(
          "session not established path={} reason={}", request.getRequestURI(), ex.reason());
      return;
    }
    final PreAuthenticatedAuthenticationToken authentication =
        new PreAuthenticatedAuthenticationToken(
            identity.subject(), "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE)));
    authentication.setDetails(identity);
    SecurityContextHolder.getContext().setAuthentication(authentication);
  }
}
