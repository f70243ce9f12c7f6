/*
 * どこで: Gateway サービス層
 * 何を: 受付判定・キー検証・非同期更新・監査書き込みのメトリクスを集約する
 * なぜ: 拒否率や検証遅延、best-effort 処理の失敗を運用で継続監視できるようにするため
 */
package com.oraclegate.gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GatewayMetrics {

  static final String METRIC_ADMISSION_TOTAL = "gateway.admission.total";
  static final String METRIC_VERIFICATION_DURATION = "gateway.key.verification.duration";
  static final String METRIC_USAGE_UPDATE_FAILURE = "gateway.usage.update.failure.total";
  static final String METRIC_AUDIT_FAILURE = "gateway.audit.write.failure.total";
  static final String METRIC_KEY_COMMAND_TOTAL = "gateway.key.command.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> admissionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final Timer verificationTimer;
  private final Counter usageUpdateFailures;
  private final Counter auditFailures;

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.verificationTimer =
        Timer.builder(METRIC_VERIFICATION_DURATION)
            .description("API key verification latency including hashing")
            .register(meterRegistry);
    this.usageUpdateFailures =
        Counter.builder(METRIC_USAGE_UPDATE_FAILURE)
            .description("Failed or dropped last-used/usage-count updates")
            .register(meterRegistry);
    this.auditFailures =
        Counter.builder(METRIC_AUDIT_FAILURE)
            .description("Audit records that could not be persisted")
            .register(meterRegistry);
  }

  /** {@code outcome} is {@code admitted} or a rejection code such as {@code quota_exceeded}. */
  public void recordAdmission(String method, String outcome) {
    final String key = method + ":" + outcome;
    admissionCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_ADMISSION_TOTAL)
                    .description("Gateway admission decisions")
                    .tags(Tags.of("method", method, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordKeyCommand(String action, String result) {
    final String key = action + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_KEY_COMMAND_TOTAL)
                    .description("API key management command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordVerification(Duration elapsed) {
    if (elapsed == null || elapsed.isNegative()) {
      return;
    }
    verificationTimer.record(elapsed);
  }

  public void recordUsageUpdateFailure() {
    usageUpdateFailures.increment();
  }

  public void recordAuditFailure() {
    auditFailures.increment();
  }
}
