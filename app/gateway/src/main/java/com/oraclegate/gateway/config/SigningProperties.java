/*
 * どこで: Gateway 設定バインド
 * 何を: 内部サービス間署名の共有秘密・ヘッダ名・呼び出し元の扱いを保持する
 * なぜ: API キーを持たない内部呼び出しを同じ受付判定に載せるため
 */
package com.oraclegate.gateway.config;

import com.oraclegate.gateway.model.RateLimitTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.signing")
public record SigningProperties(
    String sharedSecret,
    String headerName,
    String serviceName,
    RateLimitTier tier,
    int maxBodyBytes) {

  public SigningProperties {
    sharedSecret = sharedSecret == null ? "" : sharedSecret;
    headerName =
        headerName == null || headerName.isBlank() ? "X-Oraclegate-Signature" : headerName;
    serviceName = serviceName == null || serviceName.isBlank() ? "internal" : serviceName;
    tier = tier == null ? RateLimitTier.ENTERPRISE : tier;
    maxBodyBytes = maxBodyBytes <= 0 ? 256 * 1024 : maxBodyBytes;
  }

  public boolean configured() {
    return !sharedSecret.isBlank();
  }

  @Override
  public String toString() {
    return "SigningProperties[headerName=" + headerName + ", serviceName=" + serviceName + "]";
  }
}
