/*
 * どこで: Gateway セキュリティ設定
 * 何を: /tools は AdmissionFilter、/v1 と /admin は内部ヘッダ認証で保護するフィルタチェーンを構成する
 * なぜ: 機械向け (API キー/署名) と人向け (BFF 経由) の入口で認証方式を分けるため
 */
package com.oraclegate.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.oraclegate.gateway.admission.AdmissionFilter;
import com.oraclegate.gateway.api.ApiErrorCode;
import com.oraclegate.gateway.api.ApiErrorResponse;
import com.oraclegate.gateway.audit.AuditRecorder;
import com.oraclegate.gateway.security.ApiKeyStore;
import com.oraclegate.gateway.security.ApiKeyVerifier;
import com.oraclegate.gateway.security.QuotaEnforcer;
import com.oraclegate.gateway.security.RequestSigner;
import com.oraclegate.gateway.service.GatewayMetrics;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
public class GatewaySecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      GatewayInternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  AdmissionFilter admissionFilter(
      ApiKeyVerifier verifier,
      ApiKeyStore store,
      RequestSigner signer,
      QuotaEnforcer quotaEnforcer,
      AuditRecorder auditRecorder,
      GatewayMetrics metrics,
      SigningProperties signingProperties,
      AdmissionProperties admissionProperties,
      ObjectMapper objectMapper) {
    return new AdmissionFilter(
        verifier,
        store,
        signer,
        quotaEnforcer,
        auditRecorder,
        metrics,
        signingProperties,
        admissionProperties,
        objectMapper);
  }

  // セキュリティチェーン内でのみ実行し、サーブレットフィルタとしての二重登録を避ける
  @Bean
  FilterRegistrationBean<AdmissionFilter> admissionFilterRegistration(AdmissionFilter filter) {
    final FilterRegistrationBean<AdmissionFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  FilterRegistrationBean<InternalApiAuthenticationFilter> internalApiFilterRegistration(
      InternalApiAuthenticationFilter filter) {
    final FilterRegistrationBean<InternalApiAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      AdmissionFilter admissionFilter,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      ObjectMapper objectMapper)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(admissionFilter, AuthorizationFilter.class)
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(
            exceptions ->
                exceptions
                    .authenticationEntryPoint(
                        (request, response, ex) -> {
                          response.setStatus(HttpStatus.UNAUTHORIZED.value());
                          response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                          objectMapper.writeValue(
                              response.getOutputStream(),
                              ApiErrorResponse.of(ApiErrorCode.UNAUTHENTICATED));
                        })
                    .accessDeniedHandler(
                        (request, response, ex) -> {
                          response.setStatus(HttpStatus.FORBIDDEN.value());
                          response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                          objectMapper.writeValue(
                              response.getOutputStream(),
                              ApiErrorResponse.of(ApiErrorCode.PERMISSION_DENIED));
                        }))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers("/admin/**")
                    .hasRole("ADMIN")
                    .requestMatchers("/tools/**", "/v1/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
