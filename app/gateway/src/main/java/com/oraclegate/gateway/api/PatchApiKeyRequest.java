package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Partial update; absent fields are left unchanged. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PatchApiKeyRequest(
    @Size(max = 128, message = "name is too long") String name, List<String> permissions) {

  public PatchApiKeyRequest {
    if (permissions != null) {
      permissions = Collections.unmodifiableList(new ArrayList<>(permissions));
    }
  }
}
