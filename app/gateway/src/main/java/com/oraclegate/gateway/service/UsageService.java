/*
 * どこで: Gateway サービス層
 * 何を: 呼び出し元の現在窓の消費量とキー別の累計使用量を集計する
 * なぜ: 利用者が 429 になる前に残量を確認できるようにするため
 */
package com.oraclegate.gateway.service;

import com.oraclegate.gateway.api.UsageResponse;
import com.oraclegate.gateway.config.QuotaProperties;
import com.oraclegate.gateway.model.QuotaWindow;
import com.oraclegate.gateway.security.ApiKeyStore;
import com.oraclegate.gateway.security.QuotaEnforcer;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UsageService {

  private final QuotaEnforcer quotaEnforcer;
  private final ApiKeyStore store;
  private final QuotaProperties quotaProperties;

  public UsageResponse usageFor(ManagementCaller caller) {
    final List<UsageResponse.WindowUsage> windows =
        quotaEnforcer.currentUsage(caller.userId()).stream().map(this::toWindowUsage).toList();
    final List<UsageResponse.KeyUsage> keys =
        store.listForOwner(caller.userId()).stream()
            .map(
                k ->
                    new UsageResponse.KeyUsage(
                        k.id(), k.keyPrefix(), k.tier().value(), k.usageCount(), k.lastUsedAt()))
            .toList();
    return new UsageResponse(caller.userId(), windows, keys);
  }

  private UsageResponse.WindowUsage toWindowUsage(QuotaWindow window) {
    return new UsageResponse.WindowUsage(
        window.operationClass().name(),
        window.tier().value(),
        window.windowStart(),
        window.windowStart().plus(quotaProperties.forClass(window.operationClass()).window()),
        window.requestCount(),
        window.requestLimit());
  }
}
