package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Stored notification request. {@code resourceVersion} increases on every status write and backs
 * the compare-and-set used by the status manager.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequest(
    UUID id,
    Map<String, String> labels,
    NotificationRequestSpec spec,
    NotificationRequestStatus status,
    long resourceVersion,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationRequest {
    labels = labels == null ? Map.of() : Map.copyOf(labels);
  }

  public NotificationRequest withStatus(
      NotificationRequestStatus nextStatus, long nextVersion, Instant nextUpdatedAt) {
    return new NotificationRequest(
        id, labels, spec, nextStatus, nextVersion, createdAt, nextUpdatedAt);
  }
}
