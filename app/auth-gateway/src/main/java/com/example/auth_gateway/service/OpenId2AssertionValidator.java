package com.example.auth_gateway.service;

import com.example.auth_gateway.config.OpenId2Properties;
import com.example.auth_gateway.model.OpenId2Assertion;
import com.example.auth_gateway.model.VerifiedIdentity;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;

/**
 * Verifies an OpenID 2.0 positive assertion through four gates, in order:
 *
 * <ol>
 *   <li>the security-relevant fields are listed in {@code openid.signed};
 *   <li>the provider confirms the assertion via {@code check_authentication};
 *   <li>the URL the browser hit matches {@code openid.return_to};
 *   <li>{@code openid.response_nonce} is fresh.
 * </ol>
 *
 * <p>Not performed: discovery of the claimed identifier and nonce reuse tracking. A nonce can be
 * replayed within its short window, which only matters if the return URL leaks.
 */
@Service
@RequiredArgsConstructor
public class OpenId2AssertionValidator {

  private static final List<String> ALWAYS_SIGNED =
      List.of("op_endpoint", "return_to", "response_nonce", "assoc_handle");
  private static final List<String> SIGNED_IF_PRESENT = List.of("claimed_id", "identity");
  private static final int NONCE_TIMESTAMP_LENGTH = 20;
  private static final int NONCE_MAX_LENGTH = 256;

  private final OpenId2CheckAuthenticationClient checkAuthenticationClient;
  private final OpenId2Properties properties;
  private final Clock clock;

  /** Verifies the callback request, using the configured return URL's realm as its origin. */
  public VerifiedIdentity verify(HttpServletRequest request) {
    final String realm = AuthUrls.realmOf(properties.returnTo());
    final OpenId2Assertion assertion =
        new OpenId2Assertion(AuthUrls.parseQuery(request.getQueryString()));
    return verify(assertion, observedUrl(realm, request.getRequestURI(), request.getQueryString()));
  }

  public VerifiedIdentity verify(OpenId2Assertion assertion, URI observedUrl) {
    verifySignedFields(assertion);
    checkAuthenticationClient.checkAuthentication(assertion);
    verifyReturnTo(observedUrl, assertion);
    verifyNonce(assertion);

    final String claimedId = assertion.get("openid.claimed_id");
    if (claimedId == null || claimedId.isBlank()) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CLAIMS, "openid.claimed_id is required");
    }
    return new VerifiedIdentity(claimedId, clock.instant(), null);
  }

  void verifySignedFields(OpenId2Assertion assertion) {
    final String signedValue = assertion.get("openid.signed");
    final List<String> signed =
        signedValue == null ? List.of() : List.of(signedValue.split(","));
    for (String field : ALWAYS_SIGNED) {
      if (!signed.contains(field)) {
        throw OpenIdVerificationException.unsignedField(field);
      }
    }
    for (String field : SIGNED_IF_PRESENT) {
      if (assertion.has("openid." + field) && !signed.contains(field)) {
        throw OpenIdVerificationException.unsignedField(field);
      }
    }
  }

  void verifyReturnTo(URI observedUrl, OpenId2Assertion assertion) {
    final String returnToValue = assertion.get("openid.return_to");
    final URI returnTo;
    try {
      returnTo = new URI(returnToValue == null ? "" : returnToValue);
    } catch (URISyntaxException ex) {
      throw OpenIdVerificationException.mismatch(
          OpenIdVerificationException.Reason.RETURN_URL_MISMATCH,
          "openid.return_to",
          returnToValue,
          observedUrl.toString());
    }
    if (!equalsIgnoreCase(observedUrl.getScheme(), returnTo.getScheme())
        || !equalsIgnoreCase(observedUrl.getHost(), returnTo.getHost())
        || observedUrl.getPort() != returnTo.getPort()
        || !Objects.equals(observedUrl.getPath(), returnTo.getPath())) {
      throw OpenIdVerificationException.mismatch(
          OpenIdVerificationException.Reason.RETURN_URL_MISMATCH,
          "openid.return_to",
          returnToValue,
          observedUrl.toString());
    }

    // return_to に含まれるクエリは実リクエストにも同じ値で存在しなければならない。
    final MultiValueMap<String, String> expected = AuthUrls.parseQuery(returnTo.getRawQuery());
    for (Map.Entry<String, List<String>> entry : expected.entrySet()) {
      final String want = entry.getValue().get(0);
      final String got = Objects.requireNonNullElse(assertion.get(entry.getKey()), "");
      if (!want.equals(got)) {
        throw OpenIdVerificationException.mismatch(
            OpenIdVerificationException.Reason.RETURN_URL_MISMATCH, entry.getKey(), want, got);
      }
    }
  }

  void verifyNonce(OpenId2Assertion assertion) {
    final String nonce = assertion.get("openid.response_nonce");
    if (nonce == null
        || nonce.length() < NONCE_TIMESTAMP_LENGTH
        || nonce.length() > NONCE_MAX_LENGTH) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.NONCE, "invalid nonce");
    }
    final Instant timestamp;
    try {
      timestamp = Instant.parse(nonce.substring(0, NONCE_TIMESTAMP_LENGTH));
    } catch (DateTimeParseException ex) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.NONCE, "invalid nonce timestamp", ex);
    }
    if (timestamp.plus(properties.nonceMaxAge()).isBefore(clock.instant())) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.NONCE,
          "nonce too old: " + timestamp,
          "openid.response_nonce",
          null,
          timestamp.toString(),
          null);
    }
  }

  static URI observedUrl(String realm, String requestUri, String queryString) {
    final String url =
        queryString == null ? realm + requestUri : realm + requestUri + "?" + queryString;
    try {
      return new URI(url);
    } catch (URISyntaxException ex) {
      throw OpenIdVerificationException.mismatch(
          OpenIdVerificationException.Reason.RETURN_URL_MISMATCH, "request url", realm, url);
    }
  }

  private boolean equalsIgnoreCase(String left, String right) {
    return left == null ? right == null : left.equalsIgnoreCase(right);
  }
}
