/*
 * どこで: auth-gateway サービス層
 * 何を: ログイン開始数と検証失敗数を理由別に記録する
 * なぜ: 認証導線の成功率と攻撃的なリクエストの増加を Prometheus から観測するため
 */
package com.example.auth_gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_VERIFICATION_FAILURE_TOTAL = "auth.verification.failure.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> failureCounters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLogin(String flow) {
    loginCounters
        .computeIfAbsent(
            flow,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Login redirects issued per protocol flow")
                    .tags(Tags.of("flow", flow))
                    .register(meterRegistry))
        .increment();
  }

  public void recordVerificationFailure(OpenIdVerificationException.Reason reason) {
    final String key = reason.name();
    failureCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_VERIFICATION_FAILURE_TOTAL)
                    .description("Assertion and session verification failures by reason")
                    .tags(Tags.of("reason", key))
                    .register(meterRegistry))
        .increment();
  }
}
