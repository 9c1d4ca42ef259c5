package com.example.auth_gateway.service;

import com.example.auth_gateway.config.OpenId2Properties;
import com.example.auth_gateway.model.VerifiedIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

// OpenID 2.0 の識別結果はセッション化せず、リクエスト単位で返す。
@Service
@RequiredArgsConstructor
public class OpenId2CallbackService {

  private static final Logger logger = LoggerFactory.getLogger(OpenId2CallbackService.class);

  private final OpenId2AssertionValidator assertionValidator;
  private final OpenId2Properties properties;

  public VerifiedIdentity complete(HttpServletRequest request, HttpServletResponse response) {
    final VerifiedIdentity identity = assertionValidator.verify(request);
    if (properties.loginCsrfProtection()) {
      verifyLoginNonce(request);
      AuthCookies.delete(response, AuthCookies.OPENID2_NONCE_COOKIE);
    }
    logger.info("openid2 identification completed claimedId={}", identity.subject());
    return identity;
  }

  // return_to に埋めた nonce と cookie を突き合わせて login CSRF を防ぐ。
  private void verifyLoginNonce(HttpServletRequest request) {
    final Optional<String> expected = AuthCookies.read(request, AuthCookies.OPENID2_NONCE_COOKIE);
    final String actual =
        AuthUrls.parseQuery(request.getQueryString()).getFirst(OpenId2LoginService.NONCE_PARAM);
    if (expected.isEmpty() || !expected.get().equals(actual)) {
      throw OpenIdVerificationException.mismatch(
          OpenIdVerificationException.Reason.NONCE_MISMATCH,
          OpenId2LoginService.NONCE_PARAM,
          expected.orElse(null),
          actual);
    }
  }
}
