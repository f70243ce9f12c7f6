/*
 * どこで: Gateway 設定バインド
 * 何を: 業務コマンド (価格取得/分析/oracle feed) の実行設定を保持する
 * なぜ: 実行バイナリ・タイムアウト・feed 停止スイッチを環境ごとに切り替えるため
 */
package com.oraclegate.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.tools")
public record ToolProperties(
    String binary,
    Duration timeout,
    int maxOutputBytes,
    boolean feedOracleEnabled,
    String defaultProvider,
    int concurrency) {

  public ToolProperties {
    binary = binary == null || binary.isBlank() ? "./bin/oracle-cli" : binary;
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    maxOutputBytes = maxOutputBytes <= 0 ? 2 * 1024 * 1024 : maxOutputBytes;
    defaultProvider =
        defaultProvider == null || defaultProvider.isBlank() ? "gemini" : defaultProvider;
    concurrency = concurrency <= 0 ? 8 : concurrency;
  }
}
