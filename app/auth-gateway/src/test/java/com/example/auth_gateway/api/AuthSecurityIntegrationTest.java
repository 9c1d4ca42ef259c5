package com.example.auth_gateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrlPattern;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.auth_gateway.model.VerifiedIdentity;
import com.example.auth_gateway.service.OpenIdVerificationException;
import com.example.auth_gateway.service.SessionService;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AuthSecurityIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @MockitoBean private SessionService sessionService;

  @BeforeEach
  void noSessionByDefault() {
    doThrow(
            new OpenIdVerificationException(
                OpenIdVerificationException.Reason.NO_SESSION, "no session cookie"))
        .when(sessionService)
        .load(any());
  }

  @Test
  void unauthenticatedMeReturns401() throws Exception {
    mockMvc.perform(get("/v1/me")).andExpect(status().isUnauthorized());
  }

  @Test
  void unauthenticatedPageRedirectsToLogin() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isFound())
        .andExpect(redirectedUrlPattern("**/login"));
  }

  @Test
  void sessionCookieAuthenticatesMeAndHome() throws Exception {
    doReturn(
            new VerifiedIdentity(
                "alice@example.com",
                Instant.parse("2026-03-01T12:00:00Z"),
                Instant.parse("2026-03-01T13:00:00Z")))
        .when(sessionService)
        .load(any());

    mockMvc
        .perform(get("/v1/me"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.email").value("alice@example.com"));
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("Hello alice@example.com"));
  }

  @Test
  void loginEndpointRedirectsToProvider() throws Exception {
    mockMvc
        .perform(get("/login"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", startsWith("https://issuer.test/authorize?")));
  }

  @Test
  void logoutWithoutCsrfReturns403() throws Exception {
    mockMvc.perform(post("/logout")).andExpect(status().isForbidden());
  }

  @Test
  void logoutWithCsrfReturns204() throws Exception {
    mockMvc.perform(post("/logout").with(csrf())).andExpect(status().isNoContent());
  }

  @Test
  void callbackPostIsExemptFromCsrfAndRejectsMissingToken() throws Exception {
    mockMvc
        .perform(post("/auth/callback"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("AUTH_INVALID_TOKEN"));
  }

  @Test
  void openId2CallbackIsPublicAndRejectsUnsignedAssertion() throws Exception {
    mockMvc
        .perform(get("/openid2/callback").queryParam("openid.mode", "id_res"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("AUTH_UNSIGNED_FIELD"));
  }

  @Test
  void errorEndpointIsAccessibleWithoutAuthentication() throws Exception {
    final int statusCode = mockMvc.perform(get("/error")).andReturn().getResponse().getStatus();
    assertThat(statusCode).isNotEqualTo(401);
  }
}
