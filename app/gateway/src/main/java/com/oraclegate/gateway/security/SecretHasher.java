/*
 * どこで: Gateway セキュリティ
 * 何を: API キーの秘密値を bcrypt で一方向ハッシュ化し、照合する
 * なぜ: DB 漏洩時でも秘密値を復元・総当たりしにくくするため
 */
package com.oraclegate.gateway.security;

import com.oraclegate.gateway.config.ApiKeyProperties;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

@Component
public class SecretHasher {

  private final BCryptPasswordEncoder encoder;
  private final String decoyDigest;

  public SecretHasher(ApiKeyProperties properties) {
    this.encoder = new BCryptPasswordEncoder(properties.hashCost());
    // 候補が無い場合も同じコストを払うための照合先
    this.decoyDigest = encoder.encode("decoy-" + properties.secretPrefix());
  }

  public String hash(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    return encoder.encode(secret);
  }

  /** Returns false for a null secret or a digest that is not a bcrypt string. */
  public boolean verify(String secret, String storedDigest) {
    if (secret == null || storedDigest == null || storedDigest.isBlank()) {
      return false;
    }
    return encoder.matches(secret, storedDigest);
  }

  public void verifyAgainstDecoy(String secret) {
    encoder.matches(secret == null ? "" : secret, decoyDigest);
  }
}
