/*
 * どこで: Gateway サービス層
 * 何を: API キーの発行/一覧/更新/失効と管理者操作を、所有者判定と監査記録つきで実行する
 * なぜ: キーの変更と監査ログの追記を同一トランザクションで確定させるため
 */
package com.oraclegate.gateway.service;

import com.oraclegate.gateway.api.ApiKeyAccessDeniedException;
import com.oraclegate.gateway.api.CreateApiKeyRequest;
import com.oraclegate.gateway.api.PatchApiKeyRequest;
import com.oraclegate.gateway.audit.AuditEvent;
import com.oraclegate.gateway.audit.AuditRecorder;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.AuditAction;
import com.oraclegate.gateway.model.AuditOutcome;
import com.oraclegate.gateway.model.AuditRecord;
import com.oraclegate.gateway.model.IssuedApiKey;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.security.ApiKeyNotFoundException;
import com.oraclegate.gateway.security.ApiKeyStore;
import com.oraclegate.gateway.security.ApiKeyValidationException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ApiKeyManagementService {

  static final int MAX_AUDIT_LIMIT = 500;

  private final ApiKeyStore store;
  private final AuditRecorder auditRecorder;
  private final GatewayMetrics metrics;

  @Transactional
  public IssuedApiKey create(ManagementCaller caller, CreateApiKeyRequest request) {
    final IssuedApiKey issued =
        store.create(
            caller.userId(),
            request.orgId(),
            request.name(),
            request.permissions(),
            request.rateLimitTier(),
            request.expiresAt());
    final ApiKeyRecord record = issued.record();
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("name", record.label());
    detail.put("key_prefix", record.keyPrefix());
    detail.put("org_id", record.orgId());
    detail.put("permissions", Permission.tokens(record.permissions()));
    detail.put("rate_limit_tier", record.tier().value());
    detail.put("expires_at", record.expiresAt() == null ? null : record.expiresAt().toString());
    audit(caller, AuditAction.API_KEY_CREATED, record.id(), AuditOutcome.SUCCESS, detail);
    metrics.recordKeyCommand("create", "success");
    return issued;
  }

  public List<ApiKeyRecord> listOwn(ManagementCaller caller) {
    return store.listForOwner(caller.userId());
  }

  public List<ApiKeyRecord> listOrg(ManagementCaller caller, String orgId) {
    if (orgId == null || orgId.isBlank()) {
      throw new ApiKeyValidationException("org_id is required");
    }
    // 組織メンバーシップはこのサービスに無いため、その組織のキーを 1 つ以上持つことを所属とみなす
    if (!caller.admin()
        && store.listForOwner(caller.userId()).stream().noneMatch(k -> orgId.equals(k.orgId()))) {
      throw new ApiKeyAccessDeniedException("caller is not a member of org " + orgId);
    }
    return store.listForOrg(orgId);
  }

  public ApiKeyRecord get(ManagementCaller caller, UUID keyId) {
    final ApiKeyRecord record =
        store.findById(keyId).orElseThrow(() -> new ApiKeyNotFoundException(keyId));
    requireOwnerOrAdmin(caller, record);
    return record;
  }

  @Transactional
  public ApiKeyRecord patch(ManagementCaller caller, UUID keyId, PatchApiKeyRequest request) {
    if (request.name() == null && request.permissions() == null) {
      throw new ApiKeyValidationException("name or permissions is required");
    }
    final ApiKeyRecord before = requireLive(keyId);
    requireOwnerOrAdmin(caller, before);

    ApiKeyRecord after = before;
    if (request.name() != null && !request.name().trim().equals(before.label())) {
      after = store.rename(keyId, request.name());
      audit(
          caller,
          AuditAction.API_KEY_RENAMED,
          keyId,
          AuditOutcome.SUCCESS,
          change("name", before.label(), after.label()));
    }
    if (request.permissions() != null) {
      final ApiKeyRecord updated = store.updatePermissions(keyId, request.permissions());
      final boolean changed = !updated.permissions().equals(after.permissions());
      audit(
          caller,
          AuditAction.API_KEY_PERMISSIONS_CHANGED,
          keyId,
          changed ? AuditOutcome.SUCCESS : AuditOutcome.NO_CHANGE,
          change(
              "permissions",
              Permission.tokens(after.permissions()),
              Permission.tokens(updated.permissions())));
      after = updated;
    }
    metrics.recordKeyCommand("patch", "success");
    return after;
  }

  /** Returns false when the key was already inactive. */
  @Transactional
  public boolean revoke(ManagementCaller caller, UUID keyId) {
    final ApiKeyRecord record =
        store.findById(keyId).orElseThrow(() -> new ApiKeyNotFoundException(keyId));
    requireOwnerOrAdmin(caller, record);
    final boolean changed = store.revoke(keyId);
    audit(
        caller,
        AuditAction.API_KEY_REVOKED,
        keyId,
        changed ? AuditOutcome.SUCCESS : AuditOutcome.NO_CHANGE,
        Map.of("name", record.label()));
    metrics.recordKeyCommand("revoke", changed ? "success" : "no_change");
    return changed;
  }

  @Transactional
  public ApiKeyRecord changeTier(ManagementCaller admin, UUID keyId, String tier) {
    final ApiKeyRecord before = requireLive(keyId);
    final ApiKeyRecord after = store.updateTier(keyId, tier);
    audit(
        admin,
        AuditAction.API_KEY_TIER_CHANGED,
        keyId,
        before.tier() == after.tier() ? AuditOutcome.NO_CHANGE : AuditOutcome.SUCCESS,
        change("rate_limit_tier", before.tier().value(), after.tier().value()));
    metrics.recordKeyCommand("change_tier", "success");
    return after;
  }

  @Transactional
  public void delete(ManagementCaller admin, UUID keyId) {
    final ApiKeyRecord record =
        store.findById(keyId).orElseThrow(() -> new ApiKeyNotFoundException(keyId));
    if (!store.delete(keyId)) {
      throw new ApiKeyNotFoundException(keyId);
    }
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("user_id", record.ownerId());
    detail.put("key_prefix", record.keyPrefix());
    detail.put("was_active", record.active());
    audit(admin, AuditAction.API_KEY_DELETED, keyId, AuditOutcome.SUCCESS, detail);
    metrics.recordKeyCommand("delete", "success");
  }

  @Transactional
  public int purgeExpired(ManagementCaller caller) {
    final int count = store.purgeExpired();
    audit(
        caller,
        AuditAction.API_KEY_EXPIRED_PURGE,
        null,
        count > 0 ? AuditOutcome.SUCCESS : AuditOutcome.NO_CHANGE,
        Map.of("deactivated", count));
    return count;
  }

  public List<AuditRecord> auditLogs(String actor, Instant since, int limit) {
    if (actor == null || actor.isBlank()) {
      throw new ApiKeyValidationException("actor is required");
    }
    if (limit <= 0 || limit > MAX_AUDIT_LIMIT) {
      throw new ApiKeyValidationException("limit must be between 1 and " + MAX_AUDIT_LIMIT);
    }
    return auditRecorder.findByActor(actor, since == null ? Instant.EPOCH : since, limit);
  }

  private ApiKeyRecord requireLive(UUID keyId) {
    return store
        .findById(keyId)
        .filter(ApiKeyRecord::active)
        .orElseThrow(() -> new ApiKeyNotFoundException(keyId));
  }

  private static void requireOwnerOrAdmin(ManagementCaller caller, ApiKeyRecord record) {
    if (!caller.admin() && !caller.owns(record.ownerId())) {
      throw new ApiKeyAccessDeniedException("api key belongs to another user");
    }
  }

  private static Map<String, Object> change(String field, Object before, Object after) {
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("field", field);
    detail.put("before", before);
    detail.put("after", after);
    return detail;
  }

  private void audit(
      ManagementCaller caller,
      AuditAction action,
      UUID keyId,
      AuditOutcome outcome,
      Map<String, Object> detail) {
    auditRecorder.record(
        new AuditEvent(
            caller.userId(),
            action,
            AuditEvent.RESOURCE_API_KEY,
            keyId == null ? null : keyId.toString(),
            outcome,
            detail,
            caller.clientIp(),
            caller.userAgent()));
  }
}
