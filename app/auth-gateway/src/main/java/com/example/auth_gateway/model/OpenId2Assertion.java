package com.example.auth_gateway.model;

import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

// OpenID 2.0 provider が返した未検証のクエリパラメータ。
public final class OpenId2Assertion {

  private final MultiValueMap<String, String> parameters;

  public OpenId2Assertion(Map<String, List<String>> parameters) {
    final LinkedMultiValueMap<String, String> copy = new LinkedMultiValueMap<>();
    parameters.forEach((key, values) -> copy.put(key, List.copyOf(values)));
    this.parameters = copy;
  }

  @Nullable
  public String get(String name) {
    return parameters.getFirst(name);
  }

  public boolean has(String name) {
    final String value = get(name);
    return value != null && !value.isEmpty();
  }

  public MultiValueMap<String, String> parameters() {
    return new LinkedMultiValueMap<>(parameters);
  }
}
