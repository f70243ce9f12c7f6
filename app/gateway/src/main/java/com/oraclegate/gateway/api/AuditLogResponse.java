package com.oraclegate.gateway.api;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.oraclegate.gateway.model.AuditRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditLogResponse(List<Entry> auditLogs) {

  public AuditLogResponse {
    auditLogs = Collections.unmodifiableList(new ArrayList<>(auditLogs));
  }

  public static AuditLogResponse from(List<AuditRecord> records) {
    return new AuditLogResponse(records.stream().map(Entry::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(
      UUID id,
      String actor,
      String action,
      String resourceType,
      String resourceId,
      String outcome,
      Instant occurredAt,
      @JsonRawValue String detail,
      String clientIp) {

    static Entry from(AuditRecord record) {
      return new Entry(
          record.id(),
          record.actor(),
          record.action().name(),
          record.resourceType(),
          record.resourceId(),
          record.outcome().name(),
          record.occurredAt(),
          record.detailJson(),
          record.clientIp());
    }
  }
}
