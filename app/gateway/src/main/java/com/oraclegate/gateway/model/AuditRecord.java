/*
 * どこで: Gateway ドメインモデル
 * 何を: audit_logs テーブル相当の追記専用レコード
 * なぜ: キー操作と拒否判定の根拠を後から確認できるようにするため
 */
package com.oraclegate.gateway.model;

import java.time.Instant;
import java.util.UUID;

public record AuditRecord(
    UUID id,
    String actor,
    AuditAction action,
    String resourceType,
    String resourceId,
    AuditOutcome outcome,
    Instant occurredAt,
    String detailJson,
    String clientIp,
    String userAgent) {}
