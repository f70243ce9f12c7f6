/*
 * どこで: Gateway 共通設定
 * 何を: Clock と、ハッシュ検証/使用量更新/ツール出力読み取りの専用スレッドプールを提供する
 * なぜ: CPU 負荷の高い bcrypt と best-effort な更新処理を、リクエストスレッドと別の
 *       上限付きプールに閉じ込めるため
 */
package com.oraclegate.gateway.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class GatewayConfig {

  public static final String HASH_EXECUTOR = "hashExecutor";
  public static final String USAGE_EXECUTOR = "usageUpdateExecutor";
  public static final String TOOL_IO_EXECUTOR = "toolIoExecutor";

  private static final int SHUTDOWN_AWAIT_SECONDS = 20;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = HASH_EXECUTOR)
  public ThreadPoolTaskExecutor hashExecutor(ApiKeyProperties properties) {
    return boundedExecutor(
        "key-hash-", properties.hashConcurrency(), properties.hashQueueCapacity());
  }

  @Bean(name = USAGE_EXECUTOR)
  public ThreadPoolTaskExecutor usageUpdateExecutor(ApiKeyProperties properties) {
    return boundedExecutor(
        "key-usage-",
        properties.usageUpdateConcurrency(),
        properties.usageUpdateQueueCapacity());
  }

  // 1 プロセスにつき stdout/stderr の読み取りで 2 スレッド使う
  @Bean(name = TOOL_IO_EXECUTOR)
  public ThreadPoolTaskExecutor toolIoExecutor(ToolProperties properties) {
    return boundedExecutor("tool-io-", properties.concurrency() * 2, 0);
  }

  private ThreadPoolTaskExecutor boundedExecutor(String prefix, int threads, int queueCapacity) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix(prefix);
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    // キュー溢れは TaskRejectedException として呼び出し側へ返す (無制限に溜めない)
    executor.setQueueCapacity(queueCapacity);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
    // 初期化は afterPropertiesSet に任せる
    return executor;
  }
}
