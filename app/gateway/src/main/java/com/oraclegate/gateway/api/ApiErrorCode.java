package com.oraclegate.gateway.api;

/** Machine-readable error codes of the management and tool APIs. */
public final class ApiErrorCode {

  public static final String VALIDATION_ERROR = "validation_error";
  public static final String NOT_FOUND = "not_found";
  public static final String PERMISSION_DENIED = "permission_denied";
  public static final String UPSTREAM_UNAVAILABLE = "upstream_unavailable";
  public static final String TOOL_FAILED = "tool_failed";
  public static final String TOOL_DISABLED = "tool_disabled";
  public static final String UNAUTHENTICATED = "unauthenticated";

  private ApiErrorCode() {}
}
