package com.oraclegate.gateway.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.oraclegate.gateway.config.QuotaProperties;
import com.oraclegate.gateway.config.QuotaProperties.ClassQuota;
import com.oraclegate.gateway.config.QuotaProperties.TierLimits;
import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.QuotaWindow;
import com.oraclegate.gateway.model.RateLimitTier;
import com.oraclegate.gateway.repository.QuotaWindowRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QuotaEnforcerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:42.250Z");
  private static final Instant MINUTE_START = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private QuotaWindowRepository repository;

  private QuotaEnforcer enforcer;

  @BeforeEach
  void setUp() {
    final QuotaProperties properties =
        new QuotaProperties(
            new ClassQuota(Duration.ofMinutes(1), new TierLimits(100, 1000, -1)),
            new ClassQuota(Duration.ofHours(1), new TierLimits(3, 30, 300)));
    enforcer = new QuotaEnforcer(repository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void acceptsWhileCounterIsBelowLimit() {
    when(repository.incrementIfBelowLimit(
            "user-1", OperationClass.GENERAL, RateLimitTier.FREE, MINUTE_START, 100, NOW))
        .thenReturn(OptionalInt.of(42));

    final QuotaDecision decision =
        enforcer.tryAcquire("user-1", RateLimitTier.FREE, OperationClass.GENERAL);

    assertThat(decision.accepted()).isTrue();
    assertThat(decision.used()).isEqualTo(42);
    assertThat(decision.limit()).isEqualTo(100);
    assertThat(decision.retryAfterSeconds()).isZero();
  }

  @Test
  void rejectsWithSecondsUntilWindowEnd() {
    when(repository.incrementIfBelowLimit(any(), any(), any(), any(), anyInt(), any()))
        .thenReturn(OptionalInt.empty());

    final QuotaDecision decision =
        enforcer.tryAcquire("user-1", RateLimitTier.FREE, OperationClass.GENERAL);

    assertThat(decision.accepted()).isFalse();
    // 12:00:42.250 から 12:01:00 まで 17.75 秒 → 切り上げ
    assertThat(decision.retryAfterSeconds()).isEqualTo(18);
  }

  @Test
  void costSensitiveOperationsUseTheirOwnWindowAndLimit() {
    when(repository.incrementIfBelowLimit(
            eq("user-1"),
            eq(OperationClass.COST_SENSITIVE),
            eq(RateLimitTier.FREE),
            eq(Instant.parse("2026-03-01T12:00:00Z")),
            eq(3),
            eq(NOW)))
        .thenReturn(OptionalInt.empty());

    final QuotaDecision decision =
        enforcer.tryAcquire("user-1", RateLimitTier.FREE, OperationClass.COST_SENSITIVE);

    assertThat(decision.accepted()).isFalse();
    assertThat(decision.retryAfterSeconds()).isEqualTo(Duration.ofMinutes(59).toSeconds() + 18);
  }

  @Test
  void negativeLimitMeansUnlimitedWithoutCounterWrite() {
    final QuotaDecision decision =
        enforcer.tryAcquire("user-1", RateLimitTier.ENTERPRISE, OperationClass.GENERAL);

    assertThat(decision.accepted()).isTrue();
    verifyNoInteractions(repository);
  }

  @Test
  void windowStartIsAlignedToWallClock() {
    assertThat(QuotaEnforcer.windowStart(NOW, Duration.ofMinutes(1))).isEqualTo(MINUTE_START);
    assertThat(QuotaEnforcer.windowStart(NOW, Duration.ofDays(1)))
        .isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
  }

  @Test
  void retryAfterIsAtLeastOneSecond() {
    final Instant almostEnd = Instant.parse("2026-03-01T12:00:59.999Z");

    assertThat(QuotaEnforcer.retryAfterSeconds(almostEnd, MINUTE_START, Duration.ofMinutes(1)))
        .isEqualTo(1);
  }

  @Test
  void currentUsageKeepsOnlyWindowsOfTheCurrentPeriod() {
    final QuotaWindow current =
        new QuotaWindow("user-1", OperationClass.GENERAL, RateLimitTier.FREE, MINUTE_START, 5, 100);
    final QuotaWindow stale =
        new QuotaWindow(
            "user-1",
            OperationClass.GENERAL,
            RateLimitTier.FREE,
            MINUTE_START.minusSeconds(60),
            100,
            100);
    when(repository.findCurrent("user-1", Instant.parse("2026-03-01T12:00:00Z")))
        .thenReturn(List.of(current, stale));

    assertThat(enforcer.currentUsage("user-1")).containsExactly(current);
    verify(repository).findCurrent(any(), any());
  }
}
