/*
 * どこで: Gateway 受付判定
 * 何を: /tools 配下のリクエストを 認証 → 権限 → クォータ の順で判定し、通過時のみ業務処理へ渡す
 * なぜ: 高コストな下流処理の前に一度だけ判定し、拒否はすべて同じ形で返して監査へ残すため
 */
package com.oraclegate.gateway.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.oraclegate.common.TraceIds;
import com.oraclegate.gateway.api.ApiErrorResponse;
import com.oraclegate.gateway.audit.AuditEvent;
import com.oraclegate.gateway.audit.AuditRecorder;
import com.oraclegate.gateway.config.AdmissionProperties;
import com.oraclegate.gateway.config.ClientAddresses;
import com.oraclegate.gateway.config.SigningProperties;
import com.oraclegate.gateway.model.AuditAction;
import com.oraclegate.gateway.model.AuditOutcome;
import com.oraclegate.gateway.model.AuthenticationMethod;
import com.oraclegate.gateway.model.GatewayIdentity;
import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.security.ApiKeyStore;
import com.oraclegate.gateway.security.ApiKeyVerifier;
import com.oraclegate.gateway.security.QuotaDecision;
import com.oraclegate.gateway.security.QuotaEnforcer;
import com.oraclegate.gateway.security.RequestSigner;
import com.oraclegate.gateway.security.VerificationResult;
import com.oraclegate.gateway.service.GatewayMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

public class AdmissionFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(AdmissionFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String MDC_TRACE_ID = "trace_id";
  private static final String PROTECTED_PREFIX = "/tools/";

  private final ApiKeyVerifier verifier;
  private final ApiKeyStore store;
  private final RequestSigner signer;
  private final QuotaEnforcer quotaEnforcer;
  private final AuditRecorder auditRecorder;
  private final GatewayMetrics metrics;
  private final SigningProperties signingProperties;
  private final AdmissionProperties admissionProperties;
  private final ObjectMapper objectMapper;

  public AdmissionFilter(
      ApiKeyVerifier verifier,
      ApiKeyStore store,
      RequestSigner signer,
      QuotaEnforcer quotaEnforcer,
      AuditRecorder auditRecorder,
      GatewayMetrics metrics,
      SigningProperties signingProperties,
      AdmissionProperties admissionProperties,
      ObjectMapper objectMapper) {
    this.verifier = verifier;
    this.store = store;
    this.signer = signer;
    this.quotaEnforcer = quotaEnforcer;
    this.auditRecorder = auditRecorder;
    this.metrics = metrics;
    this.signingProperties = signingProperties;
    this.admissionProperties = admissionProperties;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(PROTECTED_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String traceId = TraceIds.resolve(request.getHeader(TraceIds.HEADER_NAME));
    response.setHeader(TraceIds.HEADER_NAME, traceId);
    MDC.put(MDC_TRACE_ID, traceId);
    try {
      final Decision decision = decide(request, response);
      if (decision.rejection() != null) {
        reject(request, response, decision);
        return;
      }
      admit(decision, traceId);
      filterChain.doFilter(decision.request(), response);
    } finally {
      MDC.remove(MDC_TRACE_ID);
    }
  }

  private Decision decide(HttpServletRequest request, HttpServletResponse response) {
    final String toolName = ToolOperation.toolNameOf(request.getRequestURI());
    final String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
    final String signature = request.getHeader(signingProperties.headerName());
    final boolean hasKey = authorization != null && !authorization.isBlank();
    final boolean hasSignature = signature != null && !signature.isBlank();

    // 両方あり/両方なしは、どちらの検証にも進めず入力誤りとして扱う
    if (hasKey == hasSignature) {
      return Decision.rejected(request, AdmissionRejection.MALFORMED_REQUEST, null, null);
    }

    final Decision authenticated =
        hasSignature
            ? authenticateSignature(request, signature)
            : authenticateApiKey(request, authorization);
    if (authenticated.rejection() != null) {
      return authenticated;
    }

    final GatewayIdentity identity = authenticated.identity();
    final Permission required = ToolOperation.requiredPermissionOf(toolName);
    if (!identity.hasPermission(required)) {
      return Decision.rejected(
          authenticated.request(), AdmissionRejection.PERMISSION_DENIED, identity, null);
    }

    final OperationClass operationClass = ToolOperation.operationClassOf(toolName);
    final QuotaDecision quota;
    try {
      quota = quotaEnforcer.tryAcquire(identity.subjectId(), identity.tier(), operationClass);
    } catch (DataAccessException ex) {
      logger.error("quota check failed subject_id={}", identity.subjectId(), ex);
      return Decision.rejected(
          authenticated.request(), AdmissionRejection.UPSTREAM_UNAVAILABLE, identity, null);
    }
    if (!quota.accepted()) {
      response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(quota.retryAfterSeconds()));
      return Decision.rejected(
          authenticated.request(),
          AdmissionRejection.QUOTA_EXCEEDED,
          identity,
          quota.retryAfterSeconds());
    }
    return authenticated;
  }

  private Decision authenticateSignature(HttpServletRequest request, String signature) {
    final byte[] body;
    try {
      body = CachedBodyHttpServletRequest.readBody(request, signingProperties.maxBodyBytes());
    } catch (IOException ex) {
      logger.warn("signed request body could not be read path={}", request.getRequestURI(), ex);
      return Decision.rejected(request, AdmissionRejection.MALFORMED_REQUEST, null, null);
    }
    if (body == null) {
      return Decision.rejected(request, AdmissionRejection.MALFORMED_REQUEST, null, null);
    }
    final CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, body);
    if (!signingProperties.configured()) {
      logger.warn("signed request received but gateway.signing.shared-secret is not configured");
      return Decision.rejected(cached, AdmissionRejection.INVALID_CREDENTIAL, null, null);
    }
    if (!signer.verify(body, signature, signingProperties.sharedSecret())) {
      return Decision.rejected(cached, AdmissionRejection.INVALID_CREDENTIAL, null, null);
    }
    return Decision.authenticated(
        cached,
        GatewayIdentity.forService(signingProperties.serviceName(), signingProperties.tier()));
  }

  private Decision authenticateApiKey(HttpServletRequest request, String authorization) {
    if (!authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return Decision.rejected(request, AdmissionRejection.MALFORMED_REQUEST, null, null);
    }
    final String presented = authorization.substring(BEARER_PREFIX.length()).trim();
    if (presented.isEmpty()) {
      return Decision.rejected(request, AdmissionRejection.MALFORMED_REQUEST, null, null);
    }
    final VerificationResult result = awaitVerification(presented);
    if (!result.isAccepted()) {
      return Decision.rejected(request, result.rejection(), null, null);
    }
    return Decision.authenticated(request, result.identity());
  }

  private VerificationResult awaitVerification(String presented) {
    final CompletableFuture<VerificationResult> future;
    try {
      future = verifier.verify(presented);
    } catch (TaskRejectedException ex) {
      logger.warn("api key verification rejected: hashing queue is full");
      return VerificationResult.rejected(AdmissionRejection.UPSTREAM_UNAVAILABLE);
    }
    try {
      return future.get(
          admissionProperties.verificationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.warn(
          "api key verification timed out after {}", admissionProperties.verificationTimeout());
      return VerificationResult.rejected(AdmissionRejection.UPSTREAM_UNAVAILABLE);
    } catch (ExecutionException ex) {
      logger.error("api key verification failed", ex.getCause());
      return VerificationResult.rejected(AdmissionRejection.UPSTREAM_UNAVAILABLE);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return VerificationResult.rejected(AdmissionRejection.UPSTREAM_UNAVAILABLE);
    }
  }

  private void admit(Decision decision, String traceId) {
    final GatewayIdentity identity = decision.identity();
    final HttpServletRequest request = decision.request();
    request.setAttribute(AdmissionAttributes.TRACE_ID, traceId);
    request.setAttribute(AdmissionAttributes.IDENTITY, identity);
    request.setAttribute(
        AdmissionAttributes.OPERATION, ToolOperation.toolNameOf(request.getRequestURI()));

    final List<SimpleGrantedAuthority> authorities =
        identity.permissions().stream()
            .map(p -> new SimpleGrantedAuthority(p.token()))
            .toList();
    SecurityContextHolder.getContext()
        .setAuthentication(
            new PreAuthenticatedAuthenticationToken(identity.subjectId(), "N/A", authorities));

    // 受付確定後にだけ使用記録を流す (拒否時は何も更新しない)
    if (identity.keyId() != null) {
      store.recordUsageAsync(identity.keyId());
    }
    metrics.recordAdmission(methodTag(identity.method()), "admitted");
    logger.debug(
        "request admitted subject_id={} path={}", identity.subjectId(), request.getRequestURI());
  }

  private void reject(HttpServletRequest request, HttpServletResponse response, Decision decision)
      throws IOException {
    final AdmissionRejection rejection = decision.rejection();
    final GatewayIdentity identity = decision.identity();
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("reason", rejection.code());
    detail.put("http_method", request.getMethod());
    detail.put("path", request.getRequestURI());
    if (decision.retryAfterSeconds() != null) {
      detail.put("retry_after_seconds", decision.retryAfterSeconds());
    }
    auditRecorder.recordQuietly(
        new AuditEvent(
            identity == null ? AuditEvent.UNKNOWN_ACTOR : identity.subjectId(),
            AuditAction.REQUEST_DENIED,
            AuditEvent.RESOURCE_REQUEST,
            ToolOperation.toolNameOf(request.getRequestURI()),
            AuditOutcome.DENIED,
            detail,
            ClientAddresses.resolve(request),
            request.getHeader(HttpHeaders.USER_AGENT)));

    metrics.recordAdmission(
        identity == null ? "none" : methodTag(identity.method()), rejection.code());
    if (rejection == AdmissionRejection.UPSTREAM_UNAVAILABLE) {
      logger.warn("request rejected code={} path={}", rejection.code(), request.getRequestURI());
    } else {
      logger.info("request rejected code={} path={}", rejection.code(), request.getRequestURI());
    }

    response.setStatus(rejection.status().value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), ApiErrorResponse.of(rejection.code()));
  }

  private static String methodTag(AuthenticationMethod method) {
    return method.name().toLowerCase(Locale.ROOT);
  }

  private record Decision(
      HttpServletRequest request,
      GatewayIdentity identity,
      AdmissionRejection rejection,
      Long retryAfterSeconds) {

    static Decision authenticated(HttpServletRequest request, GatewayIdentity identity) {
      return new Decision(request, identity, null, null);
    }

    static Decision rejected(
        HttpServletRequest request,
        AdmissionRejection rejection,
        GatewayIdentity identity,
        Long retryAfterSeconds) {
      return new Decision(request, identity, rejection, retryAfterSeconds);
    }
  }
}
