package com.oraclegate.gateway.config;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the requester's network origin, honouring the first X-Forwarded-For hop. */
public final class ClientAddresses {

  private ClientAddresses() {}

  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
