package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ToolResponse(boolean ok, JsonNode data, String traceId) {

  public static ToolResponse of(JsonNode data, String traceId) {
    return new ToolResponse(true, data, traceId);
  }
}
