/*
 * どこで: Gateway 設定バインド
 * 何を: API キーの形式・ハッシュコスト・ハッシュ/使用量更新の並列度を保持する
 * なぜ: 運用環境ごとに CPU コストとスループットを調整できるようにするため
 */
package com.oraclegate.gateway.config;

import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.api-key")
public record ApiKeyProperties(
    String secretPrefix,
    int secretBytes,
    int displayPrefixLength,
    int hashCost,
    int hashConcurrency,
    int hashQueueCapacity,
    int usageUpdateConcurrency,
    int usageUpdateQueueCapacity) {

  // bcrypt は先頭 72 バイトしか扱えない
  static final int MAX_SECRET_LENGTH = 72;
  static final int MIN_SECRET_BYTES = 16;

  public ApiKeyProperties {
    secretPrefix = secretPrefix == null || secretPrefix.isBlank() ? "og_pk_" : secretPrefix;
    secretBytes = secretBytes <= 0 ? 32 : secretBytes;
    final int maxSecretBytes = maxSecretBytes(secretPrefix);
    if (maxSecretBytes < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "gateway.api-key.secret-prefix is too long: " + secretPrefix.length() + " characters");
    }
    secretBytes = Math.min(secretBytes, maxSecretBytes);
    // 表示用 prefix は検索キーも兼ねるため、ランダム部を最低 8 文字含める
    displayPrefixLength =
        displayPrefixLength <= secretPrefix.length() + 7
            ? secretPrefix.length() + 8
            : displayPrefixLength;
    hashCost = hashCost <= 0 ? 10 : hashCost;
    hashConcurrency = hashConcurrency <= 0 ? 4 : hashConcurrency;
    hashQueueCapacity = hashQueueCapacity <= 0 ? 200 : hashQueueCapacity;
    usageUpdateConcurrency = usageUpdateConcurrency <= 0 ? 2 : usageUpdateConcurrency;
    usageUpdateQueueCapacity = usageUpdateQueueCapacity <= 0 ? 1000 : usageUpdateQueueCapacity;
  }

  /** Largest random part whose unpadded base64url text still fits next to the prefix. */
  static int maxSecretBytes(String secretPrefix) {
    final int remaining =
        MAX_SECRET_LENGTH - secretPrefix.getBytes(StandardCharsets.UTF_8).length;
    return remaining <= 0 ? 0 : remaining * 3 / 4;
  }
}
