/*
 * どこで: Gateway API
 * 何を: 利用者本人による API キーの発行/一覧/更新/失効と使用量参照のエンドポイントを提供する
 * なぜ: BFF で認証済みのユーザーが自分のキーを自己管理できるようにするため
 */
package com.oraclegate.gateway.api;

import com.oraclegate.gateway.service.ApiKeyManagementService;
import com.oraclegate.gateway.service.UsageService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class ApiKeyController {

  private final ApiKeyManagementService managementService;
  private final UsageService usageService;

  @PostMapping("/api-keys")
  public ResponseEntity<IssuedApiKeyResponse> create(
      Authentication authentication,
      HttpServletRequest request,
      @Valid @RequestBody CreateApiKeyRequest body) {
    final IssuedApiKeyResponse response =
        IssuedApiKeyResponse.from(
            managementService.create(ManagementCallers.from(authentication, request), body));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/api-keys")
  public ApiKeysResponse listOwn(Authentication authentication, HttpServletRequest request) {
    return new ApiKeysResponse(
        managementService.listOwn(ManagementCallers.from(authentication, request)).stream()
            .map(ApiKeyResponse::from)
            .toList());
  }

  @GetMapping("/orgs/{orgId}/api-keys")
  public ApiKeysResponse listOrg(
      Authentication authentication,
      HttpServletRequest request,
      @PathVariable("orgId") String orgId) {
    return new ApiKeysResponse(
        managementService.listOrg(ManagementCallers.from(authentication, request), orgId).stream()
            .map(ApiKeyResponse::from)
            .toList());
  }

  @GetMapping("/api-keys/{keyId}")
  public ApiKeyResponse get(
      Authentication authentication,
      HttpServletRequest request,
      @PathVariable("keyId") UUID keyId) {
    return ApiKeyResponse.from(
        managementService.get(ManagementCallers.from(authentication, request), keyId));
  }

  @PatchMapping("/api-keys/{keyId}")
  public ApiKeyResponse patch(
      Authentication authentication,
      HttpServletRequest request,
      @PathVariable("keyId") UUID keyId,
      @Valid @RequestBody PatchApiKeyRequest body) {
    return ApiKeyResponse.from(
        managementService.patch(ManagementCallers.from(authentication, request), keyId, body));
  }

  @DeleteMapping("/api-keys/{keyId}")
  public RevokeApiKeyResponse revoke(
      Authentication authentication,
      HttpServletRequest request,
      @PathVariable("keyId") UUID keyId) {
    final boolean revoked =
        managementService.revoke(ManagementCallers.from(authentication, request), keyId);
    return new RevokeApiKeyResponse(keyId, revoked);
  }

  @GetMapping("/usage")
  public UsageResponse usage(Authentication authentication, HttpServletRequest request) {
    return usageService.usageFor(ManagementCallers.from(authentication, request));
  }
}
