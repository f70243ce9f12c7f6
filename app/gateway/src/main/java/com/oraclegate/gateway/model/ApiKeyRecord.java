/*
 * どこで: Gateway ドメインモデル
 * 何を: api_keys テーブル相当のドメインレコード
 * なぜ: Store/Verifier/API 間でキー情報の受け渡しを明確にするため (生の秘密値は保持しない)
 */
package com.oraclegate.gateway.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

public record ApiKeyRecord(
    UUID id,
    String keyHash,
    String keyPrefix,
    String ownerId,
    String orgId,
    String label,
    Set<Permission> permissions,
    Instant createdAt,
    Instant lastUsedAt,
    Instant expiresAt,
    boolean active,
    RateLimitTier tier,
    long usageCount) {

  public ApiKeyRecord {
    permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
  }

  public boolean isUsableAt(Instant now) {
    return active && (expiresAt == null || expiresAt.isAfter(now));
  }
}
