package com.oraclegate.gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.oraclegate.gateway.api.UsageResponse;
import com.oraclegate.gateway.config.QuotaProperties;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.model.QuotaWindow;
import com.oraclegate.gateway.model.RateLimitTier;
import com.oraclegate.gateway.security.ApiKeyStore;
import com.oraclegate.gateway.security.QuotaEnforcer;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UsageServiceTest {

  private static final Instant WINDOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private QuotaEnforcer quotaEnforcer;
  @Mock private ApiKeyStore store;

  @Test
  void reportsCurrentWindowsWithResetTimeAndPerKeyTotals() {
    final UsageService service =
        new UsageService(quotaEnforcer, store, new QuotaProperties(null, null));
    final UUID keyId = UUID.randomUUID();
    when(quotaEnforcer.currentUsage("user-1"))
        .thenReturn(
            List.of(
                new QuotaWindow(
                    "user-1", OperationClass.GENERAL, RateLimitTier.PRO, WINDOW, 7, 1000)));
    when(store.listForOwner("user-1"))
        .thenReturn(
            List.of(
                new ApiKeyRecord(
                    keyId,
                    "hash",
                    "og_pk_abcdefgh",
                    "user-1",
                    null,
                    "ci",
                    Set.of(Permission.TOOLS_READ),
                    WINDOW.minusSeconds(3600),
                    WINDOW.plusSeconds(5),
                    null,
                    true,
                    RateLimitTier.PRO,
                    42L)));

    final UsageResponse usage =
        service.usageFor(new ManagementCaller("user-1", false, null, null));

    assertThat(usage.subjectId()).isEqualTo("user-1");
    assertThat(usage.windows())
        .singleElement()
        .satisfies(
            window -> {
              assertThat(window.operationClass()).isEqualTo("GENERAL");
              assertThat(window.resetsAt()).isEqualTo(WINDOW.plusSeconds(60));
              assertThat(window.requestCount()).isEqualTo(7);
              assertThat(window.requestLimit()).isEqualTo(1000);
            });
    assertThat(usage.keys())
        .singleElement()
        .satisfies(
            key -> {
              assertThat(key.id()).isEqualTo(keyId);
              assertThat(key.usageCount()).isEqualTo(42L);
              assertThat(key.rateLimitTier()).isEqualTo("pro");
            });
  }
}
