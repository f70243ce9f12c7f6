/*
 * どこで: Gateway API
 * 何を: POST /v1/api-keys の入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateApiKeyRequest(
    @NotBlank(message = "name is required") @Size(max = 128, message = "name is too long")
        String name,
    String orgId,
    @NotEmpty(message = "permissions must not be empty") List<String> permissions,
    String rateLimitTier,
    Instant expiresAt) {

  public CreateApiKeyRequest {
    if (permissions != null) {
      permissions = Collections.unmodifiableList(new ArrayList<>(permissions));
    }
  }
}
