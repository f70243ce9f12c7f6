package com.oraclegate.gateway.admission;

import com.oraclegate.gateway.model.GatewayIdentity;
import jakarta.servlet.http.HttpServletRequest;

/** Request attribute names set by {@link AdmissionFilter} for admitted requests. */
public final class AdmissionAttributes {

  public static final String TRACE_ID = AdmissionAttributes.class.getName() + ".TRACE_ID";
  public static final String IDENTITY = AdmissionAttributes.class.getName() + ".IDENTITY";
  public static final String OPERATION = AdmissionAttributes.class.getName() + ".OPERATION";

  private AdmissionAttributes() {}

  public static GatewayIdentity identity(HttpServletRequest request) {
    final Object value = request.getAttribute(IDENTITY);
    if (value instanceof GatewayIdentity identity) {
      return identity;
    }
    throw new IllegalStateException("request was not admitted");
  }

  public static String traceId(HttpServletRequest request) {
    final Object value = request.getAttribute(TRACE_ID);
    return value instanceof String traceId ? traceId : null;
  }
}
