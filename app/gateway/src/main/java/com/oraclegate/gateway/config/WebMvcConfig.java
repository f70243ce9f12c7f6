/*
 * どこで: Gateway Web 設定
 * 何を: RequestMdcInterceptor を API リクエストへ適用する
 * なぜ: 受付判定後の業務ログへ trace/subject を安定して埋め込むため
 */
package com.oraclegate.gateway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(requestMdcInterceptor)
        .addPathPatterns("/tools/**", "/v1/**", "/admin/**");
  }
}
