/*
 * どこで: Gateway retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れキーと古い窓を片付けるため
 */
package com.oraclegate.gateway.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gateway.retention.enabled", havingValue = "true")
public class GatewayRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(GatewayRetentionWorker.class);

  private final GatewayRetentionService retentionService;

  @Scheduled(fixedDelayString = "${gateway.retention.cleanup-interval}")
  public void run() {
    try {
      retentionService.cleanup();
    } catch (DataAccessException ex) {
      // 次回の実行で再試行される
      logger.warn("gateway retention cleanup failed", ex);
    }
  }
}
