/*
 * どこで: Gateway API
 * 何を: GET /v1/usage の出力 (現在窓の消費量とキー別の累計) を表す
 * なぜ: 利用者が残りの許容量と各キーの使用状況を確認できるようにするため
 */
package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UsageResponse(String subjectId, List<WindowUsage> windows, List<KeyUsage> keys) {

  public UsageResponse {
    windows = Collections.unmodifiableList(new ArrayList<>(windows));
    keys = Collections.unmodifiableList(new ArrayList<>(keys));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record WindowUsage(
      String operationClass,
      String rateLimitTier,
      Instant windowStart,
      Instant resetsAt,
      int requestCount,
      int requestLimit) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record KeyUsage(
      UUID id, String keyPrefix, String rateLimitTier, long usageCount, Instant lastUsedAt) {}
}
