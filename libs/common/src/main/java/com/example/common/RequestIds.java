package com.example.common;

import java.util.UUID;

public final class RequestIds {
  private static final int MAX_LENGTH = 128;

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  // 上流が付与した X-Request-Id を優先し、空や過長な値は採番し直す。
  public static String fromHeader(String headerValue) {
    if (headerValue == null || headerValue.isBlank() || headerValue.length() > MAX_LENGTH) {
      return newRequestId();
    }
    return headerValue.trim();
  }
}
