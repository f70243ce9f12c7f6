package com.oraclegate.gateway.security;

/**
 * Outcome of a quota check. {@code retryAfterSeconds} is zero when accepted and at least one when
 * rejected.
 */
public record QuotaDecision(boolean accepted, long retryAfterSeconds, int limit, int used) {

  public static QuotaDecision accepted(int limit, int used) {
    return new QuotaDecision(true, 0L, limit, used);
  }

  public static QuotaDecision unlimited() {
    return new QuotaDecision(true, 0L, -1, 0);
  }

  public static QuotaDecision rejected(long retryAfterSeconds, int limit) {
    return new QuotaDecision(false, Math.max(1L, retryAfterSeconds), limit, limit);
  }
}
