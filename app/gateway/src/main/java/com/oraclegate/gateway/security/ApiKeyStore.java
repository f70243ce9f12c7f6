/*
 * どこで: Gateway セキュリティ
 * 何を: API キーの発行・検索・失効・部分更新・期限切れ無効化を担う
 * なぜ: api_keys の永続化をこのクラスに閉じ、秘密値は発行時に 1 回だけ返すため
 */
package com.oraclegate.gateway.security;

import com.oraclegate.gateway.config.GatewayConfig;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.IssuedApiKey;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.model.RateLimitTier;
import com.oraclegate.gateway.repository.ApiKeyRepository;
import com.oraclegate.gateway.service.GatewayMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

@Component
public class ApiKeyStore {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyStore.class);
  private static final int MAX_LABEL_LENGTH = 128;

  private final ApiKeyRepository repository;
  private final SecretHasher hasher;
  private final ApiKeyGenerator generator;
  private final GatewayMetrics metrics;
  private final TaskExecutor usageUpdateExecutor;
  private final Clock clock;

  public ApiKeyStore(
      ApiKeyRepository repository,
      SecretHasher hasher,
      ApiKeyGenerator generator,
      GatewayMetrics metrics,
      @Qualifier(GatewayConfig.USAGE_EXECUTOR) TaskExecutor usageUpdateExecutor,
      Clock clock) {
    this.repository = repository;
    this.hasher = hasher;
    this.generator = generator;
    this.metrics = metrics;
    this.usageUpdateExecutor = usageUpdateExecutor;
    this.clock = clock;
  }

  public IssuedApiKey create(
      String ownerId,
      String orgId,
      String label,
      Collection<String> permissionTokens,
      String tier,
      Instant expiresAt) {
    requireText(ownerId, "owner_id is required");
    requireText(label, "name is required");
    if (label.length() > MAX_LABEL_LENGTH) {
      throw new ApiKeyValidationException("name must be at most 128 characters");
    }
    final Set<Permission> permissions = parsePermissions(permissionTokens);
    final RateLimitTier rateLimitTier = parseTier(tier);
    final Instant now = Instant.now(clock);

    final String secret = generator.newSecret();
    final ApiKeyRecord record =
        new ApiKeyRecord(
            UUID.randomUUID(),
            hasher.hash(secret),
            generator.displayPrefix(secret),
            ownerId,
            blankToNull(orgId),
            label.trim(),
            permissions,
            now,
            null,
            expiresAt,
            true,
            rateLimitTier,
            0L);
    final ApiKeyRecord saved = repository.insert(record);
    logger.info(
        "api key issued key_id={} owner_id={} prefix={} tier={}",
        saved.id(),
        saved.ownerId(),
        saved.keyPrefix(),
        saved.tier().value());
    return new IssuedApiKey(secret, saved);
  }

  /** Active and unexpired only. */
  public Optional<ApiKeyRecord> findByDigest(String digest) {
    if (digest == null || digest.isBlank()) {
      return Optional.empty();
    }
    return repository.findLiveByHash(digest, Instant.now(clock));
  }

  public List<ApiKeyRecord> findLiveCandidates(String displayPrefix) {
    if (displayPrefix == null) {
      return List.of();
    }
    return repository.findLiveByPrefix(displayPrefix, Instant.now(clock));
  }

  public Optional<ApiKeyRecord> findById(UUID id) {
    return repository.findById(id);
  }

  public List<ApiKeyRecord> listForOwner(String ownerId) {
    return repository.findActiveByOwner(ownerId);
  }

  public List<ApiKeyRecord> listForOrg(String orgId) {
    return repository.findActiveByOrg(orgId);
  }

  /**
   * Schedules the last-used/usage-count update. Never throws; a full queue or a store failure is
   * logged and counted.
   */
  public void recordUsageAsync(UUID id) {
    final Instant usedAt = Instant.now(clock);
    try {
      usageUpdateExecutor.execute(() -> recordUsage(id, usedAt));
    } catch (TaskRejectedException ex) {
      metrics.recordUsageUpdateFailure();
      logger.warn("usage update dropped key_id={} reason=queue_full", id);
    }
  }

  private void recordUsage(UUID id, Instant usedAt) {
    try {
      repository.recordUsage(id, usedAt);
    } catch (RuntimeException ex) {
      metrics.recordUsageUpdateFailure();
      logger.warn("usage update failed key_id={}", id, ex);
    }
  }

  /** Returns true only when this call moved the key from active to inactive. */
  public boolean revoke(UUID id) {
    final boolean changed = repository.deactivate(id) > 0;
    if (changed) {
      logger.info("api key revoked key_id={}", id);
    }
    return changed;
  }

  public ApiKeyRecord updatePermissions(UUID id, Collection<String> permissionTokens) {
    final Set<Permission> permissions = parsePermissions(permissionTokens);
    return repository
        .updatePermissions(id, permissions)
        .orElseThrow(() -> new ApiKeyNotFoundException(id));
  }

  public ApiKeyRecord updateTier(UUID id, String tier) {
    requireText(tier, "rate_limit_tier is required");
    final RateLimitTier rateLimitTier = parseTier(tier);
    return repository.updateTier(id, rateLimitTier).orElseThrow(() -> new ApiKeyNotFoundException(id));
  }

  public ApiKeyRecord rename(UUID id, String label) {
    requireText(label, "name is required");
    if (label.length() > MAX_LABEL_LENGTH) {
      throw new ApiKeyValidationException("name must be at most 128 characters");
    }
    return repository.updateName(id, label.trim()).orElseThrow(() -> new ApiKeyNotFoundException(id));
  }

  public int purgeExpired() {
    final int count = repository.deactivateExpired(Instant.now(clock));
    if (count > 0) {
      logger.info("expired api keys deactivated count={}", count);
    }
    return count;
  }

  public boolean delete(UUID id) {
    final boolean deleted = repository.delete(id) > 0;
    if (deleted) {
      logger.info("api key deleted key_id={}", id);
    }
    return deleted;
  }

  private Set<Permission> parsePermissions(Collection<String> tokens) {
    if (tokens == null || tokens.isEmpty()) {
      throw new ApiKeyValidationException("permissions must not be empty");
    }
    final Set<Permission> permissions = new LinkedHashSet<>();
    for (String token : tokens) {
      permissions.add(
          Permission.fromToken(token)
              .orElseThrow(() -> new ApiKeyValidationException("unknown permission: " + token)));
    }
    return permissions;
  }

  private RateLimitTier parseTier(String tier) {
    if (tier == null || tier.isBlank()) {
      return RateLimitTier.FREE;
    }
    return RateLimitTier.fromValue(tier)
        .orElseThrow(() -> new ApiKeyValidationException("unknown rate_limit_tier: " + tier));
  }

  private static void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new ApiKeyValidationException(message);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
