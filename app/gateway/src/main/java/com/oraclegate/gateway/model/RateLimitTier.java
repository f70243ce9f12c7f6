/*
 * どこで: Gateway ドメインモデル
 * 何を: クォータ上限を決めるサービスレベルを定義する
 * なぜ: tier ごとの上限値を設定から引けるようにするため
 */
package com.oraclegate.gateway.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum RateLimitTier {
  FREE,
  PRO,
  ENTERPRISE;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<RateLimitTier> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
  }
}
