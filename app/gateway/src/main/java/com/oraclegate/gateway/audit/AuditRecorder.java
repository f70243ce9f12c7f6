/*
 * どこで: Gateway 監査
 * 何を: キー操作と受付拒否を audit_logs へ追記し、actor 単位で参照する
 * なぜ: 誰が何をしたか/なぜ拒否されたかを後から追跡できるようにするため
 */
package com.oraclegate.gateway.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oraclegate.gateway.model.AuditRecord;
import com.oraclegate.gateway.repository.AuditLogRepository;
import com.oraclegate.gateway.service.GatewayMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditRecorder {

  private static final Logger logger = LoggerFactory.getLogger(AuditRecorder.class);
  // audit_logs の列幅に合わせる
  static final int MAX_RESOURCE_ID_LENGTH = 160;
  static final int MAX_IP_ADDRESS_LENGTH = 64;
  static final int MAX_USER_AGENT_LENGTH = 512;

  private final AuditLogRepository repository;
  private final ObjectMapper objectMapper;
  private final GatewayMetrics metrics;
  private final Clock clock;

  /** Appends within the caller's transaction; failures propagate and roll the change back. */
  public AuditRecord record(AuditEvent event) {
    final AuditRecord record =
        new AuditRecord(
            UUID.randomUUID(),
            event.actor(),
            event.action(),
            event.resourceType(),
            truncate(event.resourceId(), MAX_RESOURCE_ID_LENGTH),
            event.outcome(),
            Instant.now(clock),
            toJson(event),
            truncate(event.clientIp(), MAX_IP_ADDRESS_LENGTH),
            truncate(event.userAgent(), MAX_USER_AGENT_LENGTH));
    repository.insert(record);
    return record;
  }

  /** Denial path: a failed write is logged and counted, never thrown. */
  public void recordQuietly(AuditEvent event) {
    try {
      record(event);
    } catch (RuntimeException ex) {
      metrics.recordAuditFailure();
      logger.error(
          "audit write failed action={} actor={} outcome={}",
          event.action(),
          event.actor(),
          event.outcome(),
          ex);
    }
  }

  public List<AuditRecord> findByActor(String actor, Instant since, int limit) {
    return repository.findByActor(actor, since, limit);
  }

  private String toJson(AuditEvent event) {
    try {
      return objectMapper.writeValueAsString(event.detail());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize audit detail", e);
    }
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
