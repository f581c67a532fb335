package com.example.notifier.api.response;

import com.example.notifier.model.NotificationRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequestSummary(
    UUID id,
    String phase,
    List<String> channels,
    int totalAttempts,
    int successfulDeliveries,
    int failedDeliveries,
    String createdAt,
    String completionTime) {

  public static NotificationRequestSummary from(NotificationRequest request) {
    return new NotificationRequestSummary(
        request.id(),
        request.status().phase().value(),
        request.spec().channels(),
        request.status().totalAttempts(),
        request.status().successfulDeliveries(),
        request.status().failedDeliveries(),
        request.createdAt() == null ? null : request.createdAt().toString(),
        request.status().completionTime() == null
            ? null
            : request.status().completionTime().toString());
  }
}
