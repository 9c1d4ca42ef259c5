package com.example.auth_gateway.model;

import java.time.Instant;
import org.springframework.lang.Nullable;

/**
 * Identity produced by a successful assertion check.
 *
 * <p>{@code subject} is the verified email for the token flow and the claimed identifier for the
 * OpenID 2.0 flow. {@code expiresAt} is only known for the token flow.
 */
public record VerifiedIdentity(String subject, Instant verifiedAt, @Nullable Instant expiresAt) {

  public VerifiedIdentity {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject is required");
    }
    if (verifiedAt == null) {
      throw new IllegalArgumentException("verifiedAt is required");
    }
  }
}
