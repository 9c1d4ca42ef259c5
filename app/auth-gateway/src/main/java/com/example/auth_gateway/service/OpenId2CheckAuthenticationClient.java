/*
 * どこで: auth-gateway サービス層
 * 何を: OpenID 2.0 アサーションを check_authentication でプロバイダに再検証する
 * なぜ: 署名鍵を共有しない stateless モードでは provider 自身に検証させる必要があるため
 */
package com.example.auth_gateway.service;

import com.example.auth_gateway.model.OpenId2Assertion;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class OpenId2CheckAuthenticationClient {

  private static final Logger logger =
      LoggerFactory.getLogger(OpenId2CheckAuthenticationClient.class);
  private static final String CHECK_AUTHENTICATION = "check_authentication";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient openId2RestClient;

  public OpenId2CheckAuthenticationClient(RestClient openId2RestClient) {
    this.openId2RestClient = openId2RestClient;
  }

  /**
   * Re-sends every response parameter to {@code openid.op_endpoint} with the mode switched to
   * {@code check_authentication}. The endpoint comes from the assertion itself since discovery is
   * not performed; gate 1 guarantees it is covered by the signature.
   */
  public void checkAuthentication(OpenId2Assertion assertion) {
    final URI endpoint = resolveEndpoint(assertion.get("openid.op_endpoint"));
    final String reply = post(endpoint, toCheckRequest(assertion));
    final Map<String, String> fields = parseKeyValueForm(reply);

    final String isValid = fields.get("is_valid");
    if (!"true".equals(isValid) || !OpenId2LoginService.NS.equals(fields.get("ns"))) {
      logger.info(
          "openid2 assertion rejected by provider endpoint={} is_valid={}", endpoint, isValid);
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.ASSERTION_REJECTED,
          "could not verify assertion",
          "is_valid",
          "true",
          isValid,
          null);
    }
  }

  private MultiValueMap<String, String> toCheckRequest(OpenId2Assertion assertion) {
    final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("openid.mode", CHECK_AUTHENTICATION);
    for (Map.Entry<String, List<String>> entry : assertion.parameters().entrySet()) {
      if ("openid.mode".equals(entry.getKey())) {
        continue;
      }
      params.addAll(entry.getKey(), entry.getValue());
    }
    return params;
  }

  private URI resolveEndpoint(String opEndpoint) {
    try {
      return AuthUrls.parseAbsolute(opEndpoint, "openid.op_endpoint");
    } catch (OpenIdVerificationException ex) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
          "openid.op_endpoint is not a usable URL",
          ex);
    }
  }

  private String post(URI endpoint, MultiValueMap<String, String> params) {
    try {
      final String body =
          openId2RestClient
              .post()
              .uri(endpoint)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(params)
              .retrieve()
              .body(String.class);
      if (body == null || body.isBlank()) {
        throw new OpenIdVerificationException(
            OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
            "check_authentication reply is empty");
      }
      return body;
    } catch (RestClientResponseException ex) {
      logger.warn(
          "openid2 check_authentication failed with http status={} endpoint={}",
          ex.getStatusCode().value(),
          endpoint);
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
          "check_authentication request failed",
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("openid2 check_authentication timed out endpoint={}", endpoint);
      } else {
        logger.warn("openid2 check_authentication connection failed endpoint={}", endpoint, ex);
      }
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
          "check_authentication request failed",
          ex);
    } catch (RestClientException ex) {
      logger.warn("openid2 check_authentication response read failed endpoint={}", endpoint, ex);
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
          "check_authentication response read failed",
          ex);
    }
  }

  // key:value を改行区切りで並べた Key-Value Form Encoding。
  private Map<String, String> parseKeyValueForm(String reply) {
    final Map<String, String> fields = new HashMap<>();
    for (String rawLine : reply.split("\n")) {
      final String line =
          rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
      if (line.isEmpty()) {
        continue;
      }
      final int colon = line.indexOf(':');
      if (colon <= 0) {
        throw new OpenIdVerificationException(
            OpenIdVerificationException.Reason.VERIFICATION_REQUEST,
            "check_authentication reply is malformed");
      }
      fields.putIfAbsent(line.substring(0, colon), line.substring(colon + 1));
    }
    return fields;
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
