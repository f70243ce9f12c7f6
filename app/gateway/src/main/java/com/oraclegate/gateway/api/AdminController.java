/*
 * どこで: Gateway 管理 API
 * 何を: tier 変更/物理削除/期限切れ一括無効化/監査ログ参照を提供する
 * なぜ: 利用者本人には許さない運用操作を ADMIN ロールに限定して公開するため
 */
package com.oraclegate.gateway.api;

import com.oraclegate.gateway.service.ApiKeyManagementService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Validated
public class AdminController {

  private final ApiKeyManagementService managementService;

  @PutMapping("/api-keys/{keyId}/tier")
  public ApiKeyResponse changeTier(
      Authentication authentication,
      HttpServletRequest request,
      @PathVariable("keyId") UUID keyId,
      @Valid @RequestBody UpdateTierRequest body) {
    return ApiKeyResponse.from(
        managementService.changeTier(
            ManagementCallers.from(authentication, request), keyId, body.rateLimitTier()));
  }

  @DeleteMapping("/api-keys/{keyId}")
  public ResponseEntity<Void> delete(
      Authentication authentication,
      HttpServletRequest request,
      @PathVariable("keyId") UUID keyId) {
    managementService.delete(ManagementCallers.from(authentication, request), keyId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/api-keys:purge-expired")
  public PurgeExpiredResponse purgeExpired(
      Authentication authentication, HttpServletRequest request) {
    return new PurgeExpiredResponse(
        managementService.purgeExpired(ManagementCallers.from(authentication, request)));
  }

  @GetMapping("/audit-logs")
  public AuditLogResponse auditLogs(
      @RequestParam("actor") String actor,
      @RequestParam(value = "since", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant since,
      @RequestParam(value = "limit", defaultValue = "100") int limit) {
    return AuditLogResponse.from(managementService.auditLogs(actor, since, limit));
  }
}
