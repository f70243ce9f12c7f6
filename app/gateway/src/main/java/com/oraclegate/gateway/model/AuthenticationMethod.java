package com.oraclegate.gateway.model;

public enum AuthenticationMethod {
  API_KEY,
  SIGNATURE
}
