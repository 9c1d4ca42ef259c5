package com.example.auth_gateway.api.response;

import java.time.Instant;

public record MeResponse(String email, Instant expiresAt) {}
