package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oraclegate.gateway.model.IssuedApiKey;

/** The only response that ever carries the raw key. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssuedApiKeyResponse(String key, ApiKeyResponse apiKey) {

  public static IssuedApiKeyResponse from(IssuedApiKey issued) {
    return new IssuedApiKeyResponse(issued.rawSecret(), ApiKeyResponse.from(issued.record()));
  }

  @Override
  public String toString() {
    return "IssuedApiKeyResponse[key=***, apiKey=" + apiKey.id() + "]";
  }
}
