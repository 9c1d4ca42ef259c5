/*
 * どこで: auth-gateway サービス層
 * 何を: realm 算出、クエリ連結、クエリ解析の共通処理
 * なぜ: 両プロトコルで同じ URL 規則を使うため
 */
package com.example.auth_gateway.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

public final class AuthUrls {
  private AuthUrls() {}

  public static URI parseAbsolute(@Nullable String url, String name) {
    if (url == null || url.isBlank()) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG, name + " is required");
    }
    final URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException ex) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG, name + " is not a valid URL", ex);
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.CONFIG, name + " must be an absolute URL");
    }
    return uri;
  }

  /** Scheme and host (with port, if any) of the given URL. */
  public static String realmOf(String url) {
    final URI uri = parseAbsolute(url, "returnUrl");
    return originOf(uri);
  }

  public static String originOf(URI uri) {
    final String origin = uri.getScheme() + "://" + uri.getHost();
    return uri.getPort() == -1 ? origin : origin + ":" + uri.getPort();
  }

  /** Appends form-encoded parameters, using {@code &} when the endpoint already has a query. */
  public static String appendQuery(String endpoint, MultiValueMap<String, String> params) {
    final String separator = endpoint.contains("?") ? "&" : "?";
    return endpoint + separator + encode(params);
  }

  public static String encode(MultiValueMap<String, String> params) {
    final StringBuilder query = new StringBuilder();
    for (Map.Entry<String, List<String>> entry : params.entrySet()) {
      for (String value : entry.getValue()) {
        if (query.length() > 0) {
          query.append('&');
        }
        query
            .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
            .append('=')
            .append(URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8));
      }
    }
    return query.toString();
  }

  /**
   * Decodes a raw query string, keeping repeated keys in order.
   *
   * @throws OpenIdVerificationException {@code MALFORMED_REQUEST} when an escape is broken
   */
  public static MultiValueMap<String, String> parseQuery(@Nullable String rawQuery) {
    final MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      final int eq = pair.indexOf('=');
      final String key = eq < 0 ? pair : pair.substring(0, eq);
      final String value = eq < 0 ? "" : pair.substring(eq + 1);
      params.add(decode(key), decode(value));
    }
    return params;
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      throw new OpenIdVerificationException(
          OpenIdVerificationException.Reason.MALFORMED_REQUEST, "query is not decodable", ex);
    }
  }
}
