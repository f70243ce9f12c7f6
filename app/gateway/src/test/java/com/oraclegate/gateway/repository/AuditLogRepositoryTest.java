package com.oraclegate.gateway.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.oraclegate.gateway.AbstractPostgresContainerTest;
import com.oraclegate.gateway.model.AuditAction;
import com.oraclegate.gateway.model.AuditOutcome;
import com.oraclegate.gateway.model.AuditRecord;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AuditLogRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private AuditLogRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM audit_logs", new MapSqlParameterSource());
  }

  @Test
  void findByActorReturnsNewestFirstWithinRange() {
    repository.insert(entry("user-1", AuditAction.API_KEY_CREATED, BASE_TIME));
    repository.insert(entry("user-1", AuditAction.API_KEY_REVOKED, BASE_TIME.plusSeconds(60)));
    repository.insert(entry("user-1", AuditAction.API_KEY_RENAMED, BASE_TIME.minusSeconds(60)));
    repository.insert(entry("user-2", AuditAction.API_KEY_CREATED, BASE_TIME));

    final List<AuditRecord> records = repository.findByActor("user-1", BASE_TIME, 10);

    assertThat(records)
        .extracting(AuditRecord::action)
        .containsExactly(AuditAction.API_KEY_REVOKED, AuditAction.API_KEY_CREATED);
    assertThat(repository.findByActor("user-1", Instant.EPOCH, 1)).hasSize(1);
  }

  @Test
  void detailIsStoredAsJson() {
    repository.insert(entry("user-1", AuditAction.API_KEY_TIER_CHANGED, BASE_TIME));

    final AuditRecord stored = repository.findByActor("user-1", Instant.EPOCH, 1).get(0);

    assertThat(stored.detailJson()).contains("\"field\"").contains("\"rate_limit_tier\"");
    assertThat(stored.outcome()).isEqualTo(AuditOutcome.SUCCESS);
    assertThat(stored.clientIp()).isEqualTo("10.0.0.1");
  }

  private static AuditRecord entry(String actor, AuditAction action, Instant at) {
    return new AuditRecord(
        UUID.randomUUID(),
        actor,
        action,
        "api_key",
        UUID.randomUUID().toString(),
        AuditOutcome.SUCCESS,
        at,
        "{\"field\":\"rate_limit_tier\",\"before\":\"free\",\"after\":\"pro\"}",
        "10.0.0.1",
        "curl/8");
  }
}
