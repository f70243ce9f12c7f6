/*
 * どこで: Gateway データアクセス
 * 何を: audit_logs の追記と actor 単位の参照を行う
 * なぜ: 監査ログは追記専用とし、更新/削除の経路を持たせないため
 */
package com.oraclegate.gateway.repository;

import static com.oraclegate.common.JdbcTimestampUtils.toInstant;
import static com.oraclegate.common.JdbcTimestampUtils.toTimestamp;

import com.oraclegate.gateway.model.AuditAction;
import com.oraclegate.gateway.model.AuditOutcome;
import com.oraclegate.gateway.model.AuditRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(AuditRecord record) {
    final String sql =
        """
        INSERT INTO audit_logs (
          id, actor, action, resource_type, resource_id, outcome, created_at,
          changes, ip_address, user_agent
        ) VALUES (
          :id, :actor, :action, :resourceType, :resourceId, :outcome, :createdAt,
          CAST(:changes AS jsonb), :ipAddress, :userAgent
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("actor", record.actor())
            .addValue("action", record.action().name())
            .addValue("resourceType", record.resourceType())
            .addValue("resourceId", record.resourceId())
            .addValue("outcome", record.outcome().name())
            .addValue("createdAt", toTimestamp(record.occurredAt()))
            .addValue("changes", record.detailJson())
            .addValue("ipAddress", record.clientIp())
            .addValue("userAgent", record.userAgent());
    return jdbcTemplate.update(sql, params);
  }

  public List<AuditRecord> findByActor(String actor, Instant since, int limit) {
    final String sql =
        """
        SELECT id, actor, action, resource_type, resource_id, outcome, created_at,
               CAST(changes AS text) AS changes, ip_address, user_agent
        FROM audit_logs
        WHERE actor = :actor AND created_at >= :since
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("actor", actor)
            .addValue("since", toTimestamp(since))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditRecord(
        rs.getObject("id", UUID.class),
        rs.getString("actor"),
        AuditAction.valueOf(rs.getString("action")),
        rs.getString("resource_type"),
        rs.getString("resource_id"),
        AuditOutcome.valueOf(rs.getString("outcome")),
        toInstant(rs.getTimestamp("created_at")),
        rs.getString("changes"),
        rs.getString("ip_address"),
        rs.getString("user_agent"));
  }
}
