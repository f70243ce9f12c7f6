/*
 * どこで: Gateway データアクセス
 * 何を: api_keys の登録/検索/状態更新を行う
 * なぜ: 失効・期限・使用量の更新を単一 SQL 文で原子的に行い、長いロックを持たないため
 */
package com.oraclegate.gateway.repository;

import static com.oraclegate.common.JdbcTimestampUtils.toInstant;
import static com.oraclegate.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.model.RateLimitTier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ApiKeyRepository {

  private static final String COLUMNS =
      """
      id, key_hash, key_prefix, user_id, org_id, name, permissions, created_at,
      last_used_at, expires_at, is_active, rate_limit_tier, usage_count
      """;
  private static final TypeReference<List<String>> TOKEN_LIST = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public ApiKeyRecord insert(ApiKeyRecord record) {
    final String sql =
        """
        INSERT INTO api_keys (
          id, key_hash, key_prefix, user_id, org_id, name, permissions, created_at,
          expires_at, is_active, rate_limit_tier, usage_count
        ) VALUES (
          :id, :keyHash, :keyPrefix, :userId, :orgId, :name, CAST(:permissions AS jsonb),
          :createdAt, :expiresAt, TRUE, :tier, 0
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("keyHash", record.keyHash())
            .addValue("keyPrefix", record.keyPrefix())
            .addValue("userId", record.ownerId())
            .addValue("orgId", record.orgId())
            .addValue("name", record.label())
            .addValue("permissions", toJson(record.permissions()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("tier", record.tier().value());
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ApiKeyRecord> findById(UUID id) {
    final String sql = "SELECT " + COLUMNS + " FROM api_keys WHERE id = :id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("id", id), this::mapRow).stream()
        .findFirst();
  }

  public Optional<ApiKeyRecord> findLiveByHash(String keyHash, Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM api_keys
            WHERE key_hash = :keyHash
              AND is_active = TRUE
              AND (expires_at IS NULL OR expires_at > :now)
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("keyHash", keyHash)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ApiKeyRecord> findLiveByPrefix(String keyPrefix, Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM api_keys
            WHERE key_prefix = :keyPrefix
              AND is_active = TRUE
              AND (expires_at IS NULL OR expires_at > :now)
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("keyPrefix", keyPrefix)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ApiKeyRecord> findActiveByOwner(String ownerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM api_keys
            WHERE user_id = :userId AND is_active = TRUE
            ORDER BY created_at DESC
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("userId", ownerId), this::mapRow);
  }

  public List<ApiKeyRecord> findActiveByOrg(String orgId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM api_keys
            WHERE org_id = :orgId AND is_active = TRUE
            ORDER BY created_at DESC
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("orgId", orgId), this::mapRow);
  }

  public int recordUsage(UUID id, Instant usedAt) {
    // 読み出しを挟まず usage_count を単調増加させる
    final String sql =
        """
        UPDATE api_keys
        SET last_used_at = :usedAt,
            usage_count = usage_count + 1
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("usedAt", toTimestamp(usedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int deactivate(UUID id) {
    // is_active = TRUE 条件で二重失効を 0 件更新にする
    final String sql = "UPDATE api_keys SET is_active = FALSE WHERE id = :id AND is_active = TRUE";
    return jdbcTemplate.update(sql, new MapSqlParameterSource("id", id));
  }

  public Optional<ApiKeyRecord> updatePermissions(UUID id, Set<Permission> permissions) {
    final String sql =
        """
        UPDATE api_keys
        SET permissions = CAST(:permissions AS jsonb)
        WHERE id = :id AND is_active = TRUE
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("permissions", toJson(permissions));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ApiKeyRecord> updateTier(UUID id, RateLimitTier tier) {
    final String sql =
        """
        UPDATE api_keys
        SET rate_limit_tier = :tier
        WHERE id = :id AND is_active = TRUE
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("tier", tier.value());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ApiKeyRecord> updateName(UUID id, String name) {
    final String sql =
        """
        UPDATE api_keys
        SET name = :name
        WHERE id = :id AND is_active = TRUE
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int deactivateExpired(Instant now) {
    final String sql =
        """
        UPDATE api_keys
        SET is_active = FALSE
        WHERE is_active = TRUE
          AND expires_at IS NOT NULL
          AND expires_at <= :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("now", toTimestamp(now)));
  }

  public int delete(UUID id) {
    return jdbcTemplate.update(
        "DELETE FROM api_keys WHERE id = :id", new MapSqlParameterSource("id", id));
  }

  private ApiKeyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ApiKeyRecord(
        rs.getObject("id", UUID.class),
        rs.getString("key_hash"),
        rs.getString("key_prefix"),
        rs.getString("user_id"),
        rs.getString("org_id"),
        rs.getString("name"),
        fromJson(rs.getString("permissions")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("last_used_at")),
        toInstant(rs.getTimestamp("expires_at")),
        rs.getBoolean("is_active"),
        RateLimitTier.fromValue(rs.getString("rate_limit_tier"))
            .orElseThrow(
                () -> new IllegalStateException("unknown rate_limit_tier in api_keys row")),
        rs.getLong("usage_count"));
  }

  private String toJson(Set<Permission> permissions) {
    try {
      return objectMapper.writeValueAsString(Permission.tokens(permissions));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize permissions", ex);
    }
  }

  // 保存済みの語彙外トークンは読み出し時に捨てる (権限を広げる方向には解釈しない)
  private Set<Permission> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return Set.of();
    }
    try {
      final Set<Permission> permissions = new LinkedHashSet<>();
      for (String token : objectMapper.readValue(json, TOKEN_LIST)) {
        Permission.fromToken(token).ifPresent(permissions::add);
      }
      return permissions;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse permissions", ex);
    }
  }
}
