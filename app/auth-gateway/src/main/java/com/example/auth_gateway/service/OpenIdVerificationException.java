/*
 * どこで: auth-gateway サービス層
 * 何を: 認証アサーション検証の失敗を種別付きで表す例外
 * なぜ: 呼び出し側とテストがメッセージ文字列ではなく Reason で分岐できるようにするため
 */
package com.example.auth_gateway.service;

import org.springframework.lang.Nullable;

public class OpenIdVerificationException extends RuntimeException {

  public enum Reason {
    CONFIG,
    UNSIGNED_FIELD,
    VERIFICATION_REQUEST,
    ASSERTION_REJECTED,
    RETURN_URL_MISMATCH,
    NONCE,
    NONCE_MISMATCH,
    INVALID_TOKEN,
    CLAIMS,
    UNVERIFIED_EMAIL,
    NO_SESSION,
    INVALID_SESSION,
    MALFORMED_REQUEST
  }

  private final Reason reason;
  @Nullable private final String field;
  @Nullable private final String expected;
  @Nullable private final String actual;

  public OpenIdVerificationException(Reason reason, String message) {
    this(reason, message, null, null, null, null);
  }

  public OpenIdVerificationException(Reason reason, String message, Throwable cause) {
    this(reason, message, null, null, null, cause);
  }

  public OpenIdVerificationException(
      Reason reason,
      String message,
      @Nullable String field,
      @Nullable String expected,
      @Nullable String actual,
      @Nullable Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.field = field;
    this.expected = expected;
    this.actual = actual;
  }

  public static OpenIdVerificationException unsignedField(String field) {
    return new OpenIdVerificationException(
        Reason.UNSIGNED_FIELD, field + " must be signed but isn't", field, null, null, null);
  }

  public static OpenIdVerificationException mismatch(
      Reason reason, String field, String expected, String actual) {
    return new OpenIdVerificationException(
        reason, field + " mismatch", field, expected, actual, null);
  }

  public Reason reason() {
    return reason;
  }

  @Nullable
  public String field() {
    return field;
  }

  @Nullable
  public String expected() {
    return expected;
  }

  @Nullable
  public String actual() {
    return actual;
  }
}
