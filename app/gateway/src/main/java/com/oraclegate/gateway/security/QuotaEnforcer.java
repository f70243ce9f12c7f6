/*
 * どこで: Gateway セキュリティ
 * 何を: subject × 操作種別の固定窓でリクエスト数を数え、上限超過を拒否する
 * なぜ: 全インスタンスが同じ DB 行を原子的に更新し、同時アクセスでも上限を守るため
 */
package com.oraclegate.gateway.security;

import com.oraclegate.gateway.config.QuotaProperties;
import com.oraclegate.gateway.config.QuotaProperties.ClassQuota;
import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.QuotaWindow;
import com.oraclegate.gateway.model.RateLimitTier;
import com.oraclegate.gateway.repository.QuotaWindowRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class QuotaEnforcer {

  private static final Logger logger = LoggerFactory.getLogger(QuotaEnforcer.class);

  private final QuotaWindowRepository repository;
  private final QuotaProperties properties;
  private final Clock clock;

  public QuotaDecision tryAcquire(
      String subjectId, RateLimitTier tier, OperationClass operationClass) {
    final ClassQuota quota = properties.forClass(operationClass);
    final int limit = quota.limitFor(tier);
    if (limit < 0) {
      return QuotaDecision.unlimited();
    }
    final Instant now = Instant.now(clock);
    final Instant windowStart = windowStart(now, quota.window());
    final OptionalInt count =
        repository.incrementIfBelowLimit(
            subjectId, operationClass, tier, windowStart, limit, now);
    if (count.isPresent()) {
      return QuotaDecision.accepted(limit, count.getAsInt());
    }
    final long retryAfter = retryAfterSeconds(now, windowStart, quota.window());
    logger.info(
        "quota exceeded subject_id={} class={} tier={} limit={} retry_after={}",
        subjectId,
        operationClass,
        tier.value(),
        limit,
        retryAfter);
    return QuotaDecision.rejected(retryAfter, limit);
  }

  /** Windows of the subject that are still current for at least one operation class. */
  public List<QuotaWindow> currentUsage(String subjectId) {
    final Instant now = Instant.now(clock);
    final Duration longest =
        properties.general().window().compareTo(properties.costSensitive().window()) >= 0
            ? properties.general().window()
            : properties.costSensitive().window();
    final Instant earliest = windowStart(now, longest);
    return repository.findCurrent(subjectId, earliest).stream()
        .filter(w -> isCurrent(w, now))
        .toList();
  }

  private boolean isCurrent(QuotaWindow window, Instant now) {
    final Duration length = properties.forClass(window.operationClass()).window();
    return window.windowStart().equals(windowStart(now, length));
  }

  static Instant windowStart(Instant now, Duration window) {
    final long windowMillis = window.toMillis();
    final long epochMillis = now.toEpochMilli();
    return Instant.ofEpochMilli(epochMillis - Math.floorMod(epochMillis, windowMillis));
  }

  static long retryAfterSeconds(Instant now, Instant windowStart, Duration window) {
    final Duration remaining = Duration.between(now, windowStart.plus(window));
    // 端数は切り上げ、最低 1 秒
    final long seconds = remaining.toMillis() / 1000 + (remaining.toMillis() % 1000 == 0 ? 0 : 1);
    return Math.max(1L, seconds);
  }
}
