/*
 * どこで: AdmissionFilter の Web スライステスト
 * 何を: 認証 → 権限 → クォータ の判定結果が HTTP ステータスとエラーコードへ正しく写ることを検証する
 * なぜ: 拒否時に下流 (ツール実行/使用記録) へ何も流れないことを保証するため
 */
package com.oraclegate.gateway.admission;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.oraclegate.gateway.api.ToolController;
import com.oraclegate.gateway.audit.AuditEvent;
import com.oraclegate.gateway.audit.AuditRecorder;
import com.oraclegate.gateway.config.AdmissionProperties;
import com.oraclegate.gateway.config.GatewayInternalApiProperties;
import com.oraclegate.gateway.config.GatewaySecurityConfig;
import com.oraclegate.gateway.config.SigningProperties;
import com.oraclegate.gateway.model.AuditAction;
import com.oraclegate.gateway.model.AuthenticationMethod;
import com.oraclegate.gateway.model.GatewayIdentity;
import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.model.RateLimitTier;
import com.oraclegate.gateway.security.ApiKeyStore;
import com.oraclegate.gateway.security.ApiKeyVerifier;
import com.oraclegate.gateway.security.QuotaDecision;
import com.oraclegate.gateway.security.QuotaEnforcer;
import com.oraclegate.gateway.security.RequestSigner;
import com.oraclegate.gateway.security.VerificationResult;
import com.oraclegate.gateway.service.GatewayMetrics;
import com.oraclegate.gateway.service.ToolService;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ToolController.class)
@AutoConfigureMockMvc
@Import({
  GatewaySecurityConfig.class,
  RequestSigner.class,
  AdmissionFilterTest.PropertiesConfig.class
})
@TestPropertySource(properties = "gateway.signing.shared-secret=test-signing-secret")
class AdmissionFilterTest {

  private static final String KEY = "og_pk_abcdefghijklmnopqrstuvwxyz0123456789";
  private static final String SIGNATURE_HEADER = "X-Oraclegate-Signature";
  private static final UUID KEY_ID = UUID.fromString("00000000-0000-0000-0000-0000000000aa");

  @Autowired private MockMvc mockMvc;
  @Autowired private RequestSigner signer;

  @MockitoBean private ApiKeyVerifier verifier;
  @MockitoBean private ApiKeyStore store;
  @MockitoBean private QuotaEnforcer quotaEnforcer;
  @MockitoBean private AuditRecorder auditRecorder;
  @MockitoBean private GatewayMetrics metrics;
  @MockitoBean private ToolService toolService;

  @TestConfiguration
  @EnableConfigurationProperties({
    SigningProperties.class,
    AdmissionProperties.class,
    GatewayInternalApiProperties.class
  })
  static class PropertiesConfig {}

  @Test
  void bothCredentialsAreRejectedBeforeAnyLookup() throws Exception {
    mockMvc
        .perform(
            post("/tools/get_price")
                .header("Authorization", "Bearer " + KEY)
                .header(SIGNATURE_HEADER, "00")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\":\"BTC\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.error").value("malformed_request"));

    verify(verifier, never()).verify(anyString());
    verify(quotaEnforcer, never()).tryAcquire(any(), any(), any());
    verify(auditRecorder)
        .recordQuietly(argThat(event -> event.action() == AuditAction.REQUEST_DENIED));
  }

  @Test
  void missingCredentialsAreMalformed() throws Exception {
    mockMvc
        .perform(post("/tools/get_price").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("malformed_request"));
  }

  @Test
  void validKeyIsAdmittedAndUsageRecorded() throws Exception {
    admitKey(Set.of(Permission.TOOLS_READ));
    when(quotaEnforcer.tryAcquire("user-1", RateLimitTier.FREE, OperationClass.GENERAL))
        .thenReturn(QuotaDecision.accepted(100, 1));
    when(toolService.invoke(eq("get_price"), any(), any()))
        .thenReturn(JsonNodeFactory.instance.objectNode().put("price", 42));

    mockMvc
        .perform(
            post("/tools/get_price")
                .header("Authorization", "Bearer " + KEY)
                .header("X-Trace-Id", "trace-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\":\"BTC\"}"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Trace-Id", "trace-123"))
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.data.price").value(42))
        .andExpect(jsonPath("$.trace_id").value("trace-123"));

    verify(store).recordUsageAsync(KEY_ID);
    verify(metrics).recordAdmission("api_key", "admitted");
  }

  @Test
  void invalidKeyIsRejectedWithoutUsageRecord() throws Exception {
    when(verifier.verify(KEY))
        .thenReturn(
            CompletableFuture.completedFuture(
                VerificationResult.rejected(AdmissionRejection.INVALID_CREDENTIAL)));

    mockMvc
        .perform(post("/tools/get_price").header("Authorization", "Bearer " + KEY))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_credential"));

    verify(store, never()).recordUsageAsync(any());
    verify(toolService, never()).invoke(any(), any(), any());
    verify(auditRecorder)
        .recordQuietly(
            argThat(
                event ->
                    event.action() == AuditAction.REQUEST_DENIED
                        && AuditEvent.UNKNOWN_ACTOR.equals(event.actor())
                        && "get_price".equals(event.resourceId())
                        && "invalid_credential".equals(event.detail().get("reason"))));
  }

  @Test
  void nonBearerAuthorizationIsMalformed() throws Exception {
    mockMvc
        .perform(post("/tools/get_price").header("Authorization", "Basic dXNlcjpwYXNz"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("malformed_request"));

    verify(verifier, never()).verify(anyString());
  }

  @Test
  void oracleFeedNeedsWritePermission() throws Exception {
    admitKey(Set.of(Permission.TOOLS_READ));

    mockMvc
        .perform(
            post("/tools/feed_oracle")
                .header("Authorization", "Bearer " + KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\":\"BTC\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("permission_denied"));

    verify(quotaEnforcer, never()).tryAcquire(any(), any(), any());
    verify(store, never()).recordUsageAsync(any());
  }

  @Test
  void exhaustedQuotaReturnsRetryAfter() throws Exception {
    admitKey(Set.of(Permission.TOOLS_READ));
    when(quotaEnforcer.tryAcquire("user-1", RateLimitTier.FREE, OperationClass.GENERAL))
        .thenReturn(QuotaDecision.rejected(18, 100));

    mockMvc
        .perform(post("/tools/get_price").header("Authorization", "Bearer " + KEY))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string("Retry-After", "18"))
        .andExpect(jsonPath("$.error").value("quota_exceeded"));

    verify(store, never()).recordUsageAsync(any());
    verify(auditRecorder)
        .recordQuietly(
            argThat(
                event ->
                    event.action() == AuditAction.REQUEST_DENIED
                        && "user-1".equals(event.actor())
                        && "quota_exceeded".equals(event.detail().get("reason"))
                        && Long.valueOf(18).equals(event.detail().get("retry_after_seconds"))));
  }

  @Test
  void providerStartingWithDashIsRejectedBeforeTheTool() throws Exception {
    admitKey(Set.of(Permission.TOOLS_READ));
    when(quotaEnforcer.tryAcquire("user-1", RateLimitTier.FREE, OperationClass.GENERAL))
        .thenReturn(QuotaDecision.accepted(100, 1));

    mockMvc
        .perform(
            post("/tools/analyze_market")
                .header("Authorization", "Bearer " + KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\":\"BTC\",\"provider\":\"--help\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_error"))
        .andExpect(jsonPath("$.message").value("provider is invalid"));

    mockMvc
        .perform(
            post("/tools/get_price")
                .header("Authorization", "Bearer " + KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\":\"-BTC\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("symbol is invalid"));

    verify(toolService, never()).invoke(any(), any(), any());
  }

  @Test
  void quotaStoreFailureIsUpstreamUnavailable() throws Exception {
    admitKey(Set.of(Permission.TOOLS_READ));
    when(quotaEnforcer.tryAcquire(any(), any(), any()))
        .thenThrow(new QueryTimeoutException("timeout"));

    mockMvc
        .perform(post("/tools/get_price").header("Authorization", "Bearer " + KEY))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("upstream_unavailable"));
  }

  @Test
  void fullHashingQueueIsUpstreamUnavailable() throws Exception {
    when(verifier.verify(KEY)).thenThrow(new TaskRejectedException("queue full"));

    mockMvc
        .perform(post("/tools/get_price").header("Authorization", "Bearer " + KEY))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("upstream_unavailable"));
  }

  @Test
  void failedVerificationIsUpstreamUnavailable() throws Exception {
    when(verifier.verify(KEY))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("db down")));

    mockMvc
        .perform(post("/tools/get_price").header("Authorization", "Bearer " + KEY))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("upstream_unavailable"));
  }

  @Test
  void validSignatureIsAdmittedAsInternalService() throws Exception {
    final byte[] body = "{\"symbol\":\"BTC\"}".getBytes(StandardCharsets.UTF_8);
    when(quotaEnforcer.tryAcquire(
            "service:internal", RateLimitTier.ENTERPRISE, OperationClass.COST_SENSITIVE))
        .thenReturn(QuotaDecision.accepted(300, 1));
    when(toolService.invoke(eq("feed_oracle"), any(), any()))
        .thenReturn(JsonNodeFactory.instance.objectNode().put("tx", "0xabc"));

    mockMvc
        .perform(
            post("/tools/feed_oracle")
                .header(SIGNATURE_HEADER, signer.sign(body, "test-signing-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.tx").value("0xabc"));

    verify(verifier, never()).verify(anyString());
    verify(store, never()).recordUsageAsync(any());
  }

  @Test
  void tamperedSignatureIsRejected() throws Exception {
    final byte[] signed = "{\"symbol\":\"BTC\"}".getBytes(StandardCharsets.UTF_8);

    mockMvc
        .perform(
            post("/tools/get_price")
                .header(SIGNATURE_HEADER, signer.sign(signed, "test-signing-secret"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"symbol\":\"ETH\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_credential"));

    verify(toolService, never()).invoke(any(), any(), any());
  }

  private void admitKey(Set<Permission> permissions) {
    final GatewayIdentity identity =
        new GatewayIdentity(
            "user-1",
            "user-1",
            "org-1",
            RateLimitTier.FREE,
            permissions,
            KEY_ID,
            AuthenticationMethod.API_KEY);
    when(verifier.verify(KEY))
        .thenReturn(CompletableFuture.completedFuture(VerificationResult.accepted(identity)));
  }
}
