package com.example.auth_gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auth_gateway.model.VerifiedIdentity;
import com.example.auth_gateway.service.OpenIdVerificationException;
import com.example.auth_gateway.service.SessionService;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class SessionCookieAuthenticationFilterTest {

  private final SessionService sessionService = mock(SessionService.class);
  private final SessionCookieAuthenticationFilter filter =
      new SessionCookieAuthenticationFilter(sessionService);

  @AfterEach
  void cleanup() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void validSessionAuthenticatesRequest() throws Exception {
    final VerifiedIdentity identity =
        new VerifiedIdentity(
            "alice@example.com",
            Instant.parse("2026-03-01T12:00:00Z"),
            Instant.parse("2026-03-01T13:00:00Z"));
    when(sessionService.load(any())).thenReturn(identity);
    final MockFilterChain chain = new MockFilterChain();

    filter.doFilter(new MockHttpServletRequest("GET", "/v1/me"), new MockHttpServletResponse(), chain);

    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication).isNotNull();
    assertThat(authentication.getName()).isEqualTo("alice@example.com");
    assertThat(authentication.getDetails()).isEqualTo(identity);
    assertThat(authentication.getAuthorities())
        .extracting(Object::toString)
        .containsExactly("ROLE_USER");
    assertThat(chain.getRequest()).isNotNull();
  }

  @Test
  void invalidSessionLeavesRequestAnonymous() throws Exception {
    when(sessionService.load(any()))
        .thenThrow(
            new OpenIdVerificationException(
                OpenIdVerificationException.Reason.NO_SESSION, "no session cookie"));
    final MockFilterChain chain = new MockFilterChain();

    filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), chain);

    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(chain.getRequest()).isNotNull();
  }

  @Test
  void existingAuthenticationIsKept() throws Exception {
    SecurityContextHolder.getContext()
        .setAuthentication(new TestingAuthenticationToken("bob@example.com", "N/A"));

    filter.doFilter(
        new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), new MockFilterChain());

    verify(sessionService, never()).load(any());
    assertThat(SecurityContextHolder.getContext().getAuthentication().getName())
        .isEqualTo("bob@example.com");
  }
}
