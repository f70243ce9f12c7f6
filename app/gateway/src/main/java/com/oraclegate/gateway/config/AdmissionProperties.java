package com.oraclegate.gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.admission")
public record AdmissionProperties(Duration verificationTimeout) {

  public AdmissionProperties {
    verificationTimeout =
        verificationTimeout == null || verificationTimeout.isNegative() || verificationTimeout.isZero()
            ? Duration.ofSeconds(2)
            : verificationTimeout;
  }
}
