package com.oraclegate.gateway.model;

public enum AuditOutcome {
  SUCCESS,
  NO_CHANGE,
  DENIED
}
