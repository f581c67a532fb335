package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Condition(
    String type, String status, String reason, String message, Instant lastTransitionTime) {

  public static final String TYPE_ROUTING_RESOLVED = "RoutingResolved";
  public static final String TYPE_SANITIZATION_DEGRADED = "SanitizationDegraded";
  public static final String STATUS_TRUE = "True";
  public static final String STATUS_FALSE = "False";
}
