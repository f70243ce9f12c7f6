package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiKeysResponse(List<ApiKeyResponse> apiKeys) {

  public ApiKeysResponse {
    // SpotBugs の EI_EXPOSE_REP 対応
    apiKeys = Collections.unmodifiableList(new ArrayList<>(apiKeys));
  }
}
