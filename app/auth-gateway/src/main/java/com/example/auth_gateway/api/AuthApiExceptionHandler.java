package com.example.auth_gateway.api;

import com.example.auth_gateway.service.AuthMetrics;
import com.example.auth_gateway.service.OpenIdVerificationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

// 検証失敗の詳細はログにのみ出し、応答は種別コードと汎用メッセージに留める。
@RestControllerAdvice
@RequiredArgsConstructor
public class AuthApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);

  private final AuthMetrics authMetrics;

  @ExceptionHandler(OpenIdVerificationException.class)
  public ResponseEntity<ApiErrorResponse> handleVerification(OpenIdVerificationException ex) {
    final OpenIdVerificationException.Reason reason = ex.reason();
    final HttpStatus status =
        switch (reason) {
          case NO_SESSION, INVALID_SESSION -> HttpStatus.UNAUTHORIZED;
          case ASSERTION_REJECTED, UNVERIFIED_EMAIL -> HttpStatus.FORBIDDEN;
          case UNSIGNED_FIELD,
              RETURN_URL_MISMATCH,
              NONCE,
              NONCE_MISMATCH,
              INVALID_TOKEN,
              CLAIMS,
              MALFORMED_REQUEST -> HttpStatus.BAD_REQUEST;
          case VERIFICATION_REQUEST -> HttpStatus.BAD_GATEWAY;
          case CONFIG -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    final String message =
        switch (reason) {
          case VERIFICATION_REQUEST -> "identity provider unavailable";
          case CONFIG -> "authentication is not configured";
          default -> "access denied";
        };

    if (reason == OpenIdVerificationException.Reason.NO_SESSION
        || reason == OpenIdVerificationException.Reason.INVALID_SESSION) {
      logger.debug("session rejected reason={} message={}", reason, ex.getMessage());
    } else {
      logger.warn(
          "authentication rejected reason={} message={} field={} expected={} actual={}",
          reason,
          ex.getMessage(),
          ex.field(),
          ex.expected(),
          ex.actual());
    }
    authMetrics.recordVerificationFailure(reason);
    return ResponseEntity.status(status).body(new ApiErrorResponse("AUTH_" + reason.name(), message));
  }
}
