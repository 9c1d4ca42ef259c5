package com.example.auth_gateway.api.response;

import java.time.Instant;

public record OpenId2IdentityResponse(String claimedId, Instant verifiedAt) {}
