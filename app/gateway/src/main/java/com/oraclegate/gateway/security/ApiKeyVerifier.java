/*
 * どこで: Gateway セキュリティ
 * 何を: 提示された API キーを検証し、呼び出し元 identity か一律の拒否を返す
 * なぜ: 未知/失効/期限切れを区別せず返し、キーの存在を推測させないため
 */
package com.oraclegate.gateway.security;

import com.oraclegate.gateway.admission.AdmissionRejection;
import com.oraclegate.gateway.config.GatewayConfig;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.GatewayIdentity;
import com.oraclegate.gateway.service.GatewayMetrics;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ApiKeyVerifier {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyVerifier.class);

  private final ApiKeyStore store;
  private final SecretHasher hasher;
  private final ApiKeyGenerator generator;
  private final GatewayMetrics metrics;
  private final Executor hashExecutor;

  public ApiKeyVerifier(
      ApiKeyStore store,
      SecretHasher hasher,
      ApiKeyGenerator generator,
      GatewayMetrics metrics,
      @Qualifier(GatewayConfig.HASH_EXECUTOR) Executor hashExecutor) {
    this.store = store;
    this.hasher = hasher;
    this.generator = generator;
    this.metrics = metrics;
    this.hashExecutor = hashExecutor;
  }

  /**
   * Runs the lookup and bcrypt comparison on the hashing executor.
   *
   * @throws org.springframework.core.task.TaskRejectedException when the hashing queue is full
   */
  public CompletableFuture<VerificationResult> verify(String presentedSecret) {
    return CompletableFuture.supplyAsync(() -> verifyNow(presentedSecret), hashExecutor);
  }

  VerificationResult verifyNow(String presentedSecret) {
    final long startedAt = System.nanoTime();
    try {
      return resolve(presentedSecret)
          .map(record -> VerificationResult.accepted(GatewayIdentity.fromApiKey(record)))
          .orElseGet(() -> VerificationResult.rejected(AdmissionRejection.INVALID_CREDENTIAL));
    } finally {
      metrics.recordVerification(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  private Optional<ApiKeyRecord> resolve(String presentedSecret) {
    final String prefix = generator.displayPrefix(presentedSecret);
    if (prefix == null) {
      hasher.verifyAgainstDecoy(presentedSecret);
      return Optional.empty();
    }
    final List<ApiKeyRecord> candidates = store.findLiveCandidates(prefix);
    if (candidates.isEmpty()) {
      hasher.verifyAgainstDecoy(presentedSecret);
      return Optional.empty();
    }
    for (ApiKeyRecord candidate : candidates) {
      if (hasher.verify(presentedSecret, candidate.keyHash())) {
        // 照合中に失効/期限切れになった場合を拾うため、判定時点の状態で読み直す
        final Optional<ApiKeyRecord> live = store.findByDigest(candidate.keyHash());
        if (live.isEmpty()) {
          logger.debug("api key matched but no longer live key_id={}", candidate.id());
        }
        return live;
      }
    }
    return Optional.empty();
  }
}
