package com.oraclegate.gateway.security;

public class ApiKeyValidationException extends RuntimeException {

  public ApiKeyValidationException(String message) {
    super(message);
  }
}
