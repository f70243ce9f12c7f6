package com.oraclegate.gateway.config;

import com.oraclegate.common.TraceIds;
import com.oraclegate.gateway.admission.AdmissionAttributes;
import com.oraclegate.gateway.model.GatewayIdentity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", resolveRequestId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", ClientAddresses.resolve(request));
    put(keys, "user_id", resolveUserId(request));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final Object traceId = request.getAttribute(AdmissionAttributes.TRACE_ID);
    if (traceId instanceof String value) {
      return value;
    }
    return TraceIds.resolve(request.getHeader("X-Request-Id"));
  }

  private String resolveUserId(HttpServletRequest request) {
    final Object identity = request.getAttribute(AdmissionAttributes.IDENTITY);
    if (identity instanceof GatewayIdentity gatewayIdentity) {
      return gatewayIdentity.subjectId();
    }
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null && authentication.isAuthenticated()) {
      final String name = authentication.getName();
      if (name != null && !name.isBlank() && !"anonymousUser".equals(name)) {
        return name;
      }
    }
    return null;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
