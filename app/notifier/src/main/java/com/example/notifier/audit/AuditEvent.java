/*
 * Where: Notifier audit
 * What: Compliance record for a delivery outcome or a completed request
 * Why: The audit sink keeps these for the configured retention period
 */
package com.example.notifier.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEvent(
    UUID eventId,
    String eventType,
    String eventCategory,
    String eventAction,
    String eventOutcome,
    String actorType,
    String actorId,
    String resourceType,
    String resourceId,
    String correlationId,
    Instant eventTimestamp,
    int retentionDays,
    Map<String, Object> eventData) {

  public AuditEvent {
    eventData = eventData == null ? Map.of() : Map.copyOf(eventData);
  }
}
