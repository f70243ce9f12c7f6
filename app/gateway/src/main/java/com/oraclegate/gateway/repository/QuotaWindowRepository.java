/*
 * どこで: Gateway データアクセス
 * 何を: quota_windows の原子的な加算と現在窓の参照/古い窓の削除を行う
 * なぜ: 同一 subject への同時リクエストでも上限を超えて受理しないため
 */
package com.oraclegate.gateway.repository;

import static com.oraclegate.common.JdbcTimestampUtils.toInstant;
import static com.oraclegate.common.JdbcTimestampUtils.toTimestamp;

import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.QuotaWindow;
import com.oraclegate.gateway.model.RateLimitTier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class QuotaWindowRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Increments the window counter only while it is below {@code limit}.
   *
   * <p>The insert-or-increment and the limit comparison are a single statement; concurrent
   * callers serialize on the row lock taken by {@code ON CONFLICT DO UPDATE}.
   *
   * @return the counter after increment, or empty when the window is already full
   */
  public OptionalInt incrementIfBelowLimit(
      String subjectId,
      OperationClass operationClass,
      RateLimitTier tier,
      Instant windowStart,
      int limit,
      Instant now) {
    if (limit <= 0) {
      return OptionalInt.empty();
    }
    final String sql =
        """
        INSERT INTO quota_windows (
          subject_id, operation_class, window_start, tier, request_count, request_limit, updated_at
        ) VALUES (
          :subjectId, :operationClass, :windowStart, :tier, 1, :limit, :now
        )
        ON CONFLICT (subject_id, operation_class, window_start) DO UPDATE
        SET request_count = quota_windows.request_count + 1,
            tier = EXCLUDED.tier,
            request_limit = EXCLUDED.request_limit,
            updated_at = EXCLUDED.updated_at
        WHERE quota_windows.request_count < :limit
        RETURNING request_count
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subjectId", subjectId)
            .addValue("operationClass", operationClass.name())
            .addValue("windowStart", toTimestamp(windowStart))
            .addValue("tier", tier.value())
            .addValue("limit", limit)
            .addValue("now", toTimestamp(now));
    final List<Integer> counts =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getInt("request_count"));
    return counts.isEmpty() ? OptionalInt.empty() : OptionalInt.of(counts.get(0));
  }

  public List<QuotaWindow> findCurrent(String subjectId, Instant notBefore) {
    final String sql =
        """
        SELECT subject_id, operation_class, window_start, tier, request_count, request_limit
        FROM quota_windows
        WHERE subject_id = :subjectId AND window_start >= :notBefore
        ORDER BY window_start DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subjectId", subjectId)
            .addValue("notBefore", toTimestamp(notBefore));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int deleteWindowsStartedBefore(Instant threshold) {
    final String sql = "DELETE FROM quota_windows WHERE window_start < :threshold";
    return jdbcTemplate.update(sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private QuotaWindow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new QuotaWindow(
        rs.getString("subject_id"),
        OperationClass.valueOf(rs.getString("operation_class")),
        RateLimitTier.fromValue(rs.getString("tier")).orElse(RateLimitTier.FREE),
        toInstant(rs.getTimestamp("window_start")),
        rs.getInt("request_count"),
        rs.getInt("request_limit"));
  }
}
