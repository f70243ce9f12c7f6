package com.oraclegate.gateway.model;

public enum AuditAction {
  API_KEY_CREATED,
  API_KEY_REVOKED,
  API_KEY_PERMISSIONS_CHANGED,
  API_KEY_RENAMED,
  API_KEY_TIER_CHANGED,
  API_KEY_DELETED,
  API_KEY_EXPIRED_PURGE,
  REQUEST_DENIED
}
