package com.oraclegate.gateway.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the end-user identity for the key management and admin APIs from headers the BFF
 * forwards after login. Requests without a valid internal token stay unauthenticated.
 */
public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";
  private static final String ADMIN_ROLE = "ROLE_ADMIN";

  private final GatewayInternalApiProperties properties;

  public InternalApiAuthenticationFilter(GatewayInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !(uri.startsWith("/v1/") || uri.startsWith("/admin/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isValidInternalToken(request.getHeader(properties.headerName()))) {
      final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
      if (forwardedUserId == null || forwardedUserId.isBlank()) {
        logger.warn(
            "internal request rejected: missing required header {} on path={}",
            properties.userIdHeaderName(),
            request.getRequestURI());
        response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
        return;
      }
      final UsernamePasswordAuthenticationToken authentication =
          new UsernamePasswordAuthenticationToken(
              forwardedUserId.trim(),
              "N/A",
              buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
      logger.debug(
          "internal authentication established for path={} authorities={}",
          request.getRequestURI(),
          authentication.getAuthorities());
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug(
          "internal authentication not established for path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    if (actualToken == null || properties.token().isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actualToken.getBytes(StandardCharsets.UTF_8),
        properties.token().getBytes(StandardCharsets.UTF_8));
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(USER_ROLE));

    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }

    for (String role : forwardedRoles.split(",")) {
      final String normalized = role == null ? "" : role.trim();
      if ("ADMIN".equals(normalized) || ADMIN_ROLE.equals(normalized)) {
        authorities.add(new SimpleGrantedAuthority(ADMIN_ROLE));
      }
    }
    return authorities;
  }
}
