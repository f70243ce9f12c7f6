package com.oraclegate.gateway.audit;

import com.oraclegate.gateway.model.AuditAction;
import com.oraclegate.gateway.model.AuditOutcome;
import java.util.Map;

/** A security-relevant decision about to be appended to the audit log. */
public record AuditEvent(
    String actor,
    AuditAction action,
    String resourceType,
    String resourceId,
    AuditOutcome outcome,
    Map<String, Object> detail,
    String clientIp,
    String userAgent) {

  public static final String UNKNOWN_ACTOR = "unknown";
  public static final String RESOURCE_API_KEY = "api_key";
  public static final String RESOURCE_REQUEST = "request";

  public AuditEvent {
    actor = actor == null || actor.isBlank() ? UNKNOWN_ACTOR : actor;
    detail = detail == null ? Map.of() : detail;
  }
}
