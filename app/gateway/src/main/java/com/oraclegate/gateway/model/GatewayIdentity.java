/*
 * どこで: Gateway ドメインモデル
 * 何を: 認証済み呼び出し元 (API キー所有者 or 署名済み内部サービス) を表す
 * なぜ: クォータ判定と業務処理の権限チェックで同じ値を参照するため
 */
package com.oraclegate.gateway.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

public record GatewayIdentity(
    String subjectId,
    String ownerId,
    String orgId,
    RateLimitTier tier,
    Set<Permission> permissions,
    UUID keyId,
    AuthenticationMethod method) {

  public GatewayIdentity {
    permissions = Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
  }

  public static GatewayIdentity fromApiKey(ApiKeyRecord record) {
    return new GatewayIdentity(
        record.ownerId(),
        record.ownerId(),
        record.orgId(),
        record.tier(),
        record.permissions(),
        record.id(),
        AuthenticationMethod.API_KEY);
  }

  public static GatewayIdentity forService(String serviceName, RateLimitTier tier) {
    return new GatewayIdentity(
        "service:" + serviceName,
        serviceName,
        null,
        tier,
        Permission.all(),
        null,
        AuthenticationMethod.SIGNATURE);
  }

  // 階層ではなく完全一致で判定する (tools:write は tools:read を含意しない)
  public boolean hasPermission(Permission permission) {
    return permissions.contains(permission);
  }
}
