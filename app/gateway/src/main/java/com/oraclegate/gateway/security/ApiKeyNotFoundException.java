package com.oraclegate.gateway.security;

import java.util.UUID;

public class ApiKeyNotFoundException extends RuntimeException {

  public ApiKeyNotFoundException(UUID keyId) {
    super("api key not found: " + keyId);
  }
}
