/*
 * どこで: Gateway retention サービス
 * 何を: 期限切れ API キーの無効化と、過去のクォータ窓の削除を行う
 * なぜ: 期限切れキーを一覧から外し、quota_windows の肥大化を防ぐため
 */
package com.oraclegate.gateway.service;

import com.oraclegate.gateway.config.GatewayRetentionProperties;
import com.oraclegate.gateway.repository.QuotaWindowRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GatewayRetentionService {

  static final String RETENTION_ACTOR = "system:retention";

  private static final Logger logger = LoggerFactory.getLogger(GatewayRetentionService.class);

  private final ApiKeyManagementService managementService;
  private final QuotaWindowRepository quotaWindowRepository;
  private final GatewayRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final int deactivatedKeys =
        managementService.purgeExpired(ManagementCaller.system(RETENTION_ACTOR));
    // 窓の開始時刻が TTL より古いものは、どの操作種別でも既に終わっている
    final Instant windowThreshold = Instant.now(clock).minus(properties.quotaWindowTtl());
    final int deletedWindows = quotaWindowRepository.deleteWindowsStartedBefore(windowThreshold);
    logger.info(
        "gateway retention cleanup deactivated apiKeys={} deleted quotaWindows={}"
            + " windowThreshold={}",
        deactivatedKeys,
        deletedWindows,
        windowThreshold);
  }
}
