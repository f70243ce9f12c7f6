package com.oraclegate.gateway.security;

import com.oraclegate.gateway.config.ApiKeyProperties;
import java.security.SecureRandom;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Produces raw API key secrets of the form {@code <prefix><base64url random bytes>}. */
@Component
@RequiredArgsConstructor
public class ApiKeyGenerator {

  private static final SecureRandom RANDOM = new SecureRandom();

  private final ApiKeyProperties properties;

  public String newSecret() {
    final byte[] bytes = new byte[properties.secretBytes()];
    RANDOM.nextBytes(bytes);
    return properties.secretPrefix() + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  /**
   * The non-secret lookup prefix shown in listings. Returns null when the value cannot be one of
   * our secrets, so callers can reject it without touching the store.
   */
  public String displayPrefix(String secret) {
    if (secret == null
        || !secret.startsWith(properties.secretPrefix())
        || secret.length() <= properties.displayPrefixLength()) {
      return null;
    }
    return secret.substring(0, properties.displayPrefixLength());
  }
}
