/*
 * Where: Notifier domain model
 * What: One recorded delivery attempt for a single channel
 * Why: The attempt list is append-only and is the source of truth for per-channel progress
 */
package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttempt(
    String channel,
    int attempt,
    Instant timestamp,
    AttemptOutcome outcome,
    FailureKind failureKind,
    String error,
    long durationMillis,
    boolean terminal,
    Instant nextRetryAt) {

  public boolean succeeded() {
    return outcome == AttemptOutcome.SUCCESS;
  }
}
