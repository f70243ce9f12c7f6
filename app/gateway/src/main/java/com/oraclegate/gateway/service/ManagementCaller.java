package com.oraclegate.gateway.service;

/** The end user behind a management API call, as forwarded by the BFF. */
public record ManagementCaller(String userId, boolean admin, String clientIp, String userAgent) {

  public static ManagementCaller system(String name) {
    return new ManagementCaller(name, true, null, null);
  }

  public boolean owns(String ownerId) {
    return userId != null && userId.equals(ownerId);
  }
}
