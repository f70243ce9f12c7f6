/*
 * どこで: Gateway API
 * 何を: API キーのメタデータ (秘密値/ハッシュを含まない) を表す
 * なぜ: 一覧/更新応答で表示 prefix だけを返し、秘密値の再表示を防ぐため
 */
package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.Permission;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiKeyResponse(
    UUID id,
    String keyPrefix,
    String name,
    String userId,
    String orgId,
    List<String> permissions,
    String rateLimitTier,
    Instant createdAt,
    Instant lastUsedAt,
    Instant expiresAt,
    boolean active,
    long usageCount) {

  public ApiKeyResponse {
    permissions = Collections.unmodifiableList(new ArrayList<>(permissions));
  }

  public static ApiKeyResponse from(ApiKeyRecord record) {
    return new ApiKeyResponse(
        record.id(),
        record.keyPrefix(),
        record.label(),
        record.ownerId(),
        record.orgId(),
        new ArrayList<>(Permission.tokens(record.permissions())),
        record.tier().value(),
        record.createdAt(),
        record.lastUsedAt(),
        record.expiresAt(),
        record.active(),
        record.usageCount());
  }
}
