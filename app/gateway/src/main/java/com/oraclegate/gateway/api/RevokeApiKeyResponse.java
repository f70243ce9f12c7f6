package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

/** {@code revoked} is false when the key was already inactive. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RevokeApiKeyResponse(UUID id, boolean revoked) {}
