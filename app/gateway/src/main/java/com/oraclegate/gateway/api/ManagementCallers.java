package com.oraclegate.gateway.api;

import com.oraclegate.gateway.config.ClientAddresses;
import com.oraclegate.gateway.service.ManagementCaller;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.Authentication;

/** Builds a {@link ManagementCaller} from the authentication set by the internal API filter. */
final class ManagementCallers {

  private static final String ADMIN_ROLE = "ROLE_ADMIN";

  private ManagementCallers() {}

  static ManagementCaller from(Authentication authentication, HttpServletRequest request) {
    final boolean admin =
        authentication.getAuthorities().stream().anyMatch(a -> ADMIN_ROLE.equals(a.getAuthority()));
    return new ManagementCaller(
        authentication.getName(),
        admin,
        ClientAddresses.resolve(request),
        request.getHeader(HttpHeaders.USER_AGENT));
  }
}
