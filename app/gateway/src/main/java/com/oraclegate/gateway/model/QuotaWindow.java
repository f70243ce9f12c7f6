/*
 * どこで: Gateway ドメインモデル
 * 何を: quota_windows テーブル相当のレコード (subject × 操作種別 × 窓)
 * なぜ: 現在窓の使用量を参照 API へ返すため
 */
package com.oraclegate.gateway.model;

import java.time.Instant;

public record QuotaWindow(
    String subjectId,
    OperationClass operationClass,
    RateLimitTier tier,
    Instant windowStart,
    int requestCount,
    int requestLimit) {}
