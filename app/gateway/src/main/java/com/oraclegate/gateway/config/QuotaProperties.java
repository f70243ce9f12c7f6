/*
 * どこで: Gateway 設定バインド
 * 何を: 操作種別ごとの窓長と tier 別上限を保持する
 * なぜ: 一般操作とコストのある操作 (oracle feed) を別カウンタ・別上限で運用するため
 */
package com.oraclegate.gateway.config;

import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.RateLimitTier;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.quota")
public record QuotaProperties(ClassQuota general, ClassQuota costSensitive) {

  public QuotaProperties {
    general =
        general == null
            ? new ClassQuota(Duration.ofMinutes(1), new TierLimits(100, 1000, 10000))
            : general;
    costSensitive =
        costSensitive == null
            ? new ClassQuota(Duration.ofMinutes(1), new TierLimits(3, 30, 300))
            : costSensitive;
  }

  public ClassQuota forClass(OperationClass operationClass) {
    return switch (operationClass) {
      case GENERAL -> general;
      case COST_SENSITIVE -> costSensitive;
    };
  }

  public record ClassQuota(Duration window, TierLimits limits) {

    public ClassQuota {
      window = window == null || window.isZero() || window.isNegative() ? Duration.ofMinutes(1) : window;
      limits = limits == null ? new TierLimits(0, 0, 0) : limits;
    }

    /** A negative limit means the tier is not counted for this class. */
    public int limitFor(RateLimitTier tier) {
      return switch (tier) {
        case FREE -> limits.free();
        case PRO -> limits.pro();
        case ENTERPRISE -> limits.enterprise();
      };
    }
  }

  public record TierLimits(int free, int pro, int enterprise) {}
}
