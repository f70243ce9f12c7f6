package com.oraclegate.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.internal-api")
public record GatewayInternalApiProperties(
    String headerName, String token, String userIdHeaderName, String userRolesHeaderName) {

  public GatewayInternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    userRolesHeaderName =
        userRolesHeaderName == null || userRolesHeaderName.isBlank()
            ? "X-User-Roles"
            : userRolesHeaderName;
  }
}
