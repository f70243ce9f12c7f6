/*
 * どこで: Gateway 設定バインド
 * 何を: 期限切れキー無効化と古いクォータ窓削除のスケジュール設定を保持する
 * なぜ: 実行間隔と有効/無効を運用で調整できるようにするため
 */
package com.oraclegate.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.retention")
public record GatewayRetentionProperties(
    boolean enabled, Duration cleanupInterval, Duration quotaWindowTtl) {

  public GatewayRetentionProperties {
    cleanupInterval = cleanupInterval == null ? Duration.ofMinutes(5) : cleanupInterval;
    quotaWindowTtl = quotaWindowTtl == null ? Duration.ofDays(1) : quotaWindowTtl;
  }
}
