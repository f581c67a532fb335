package com.example.notifier.api.response;

import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestSpec;
import com.example.notifier.model.NotificationRequestStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequestResponse(
    UUID id,
    Map<String, String> labels,
    NotificationRequestSpec spec,
    NotificationRequestStatus status,
    long resourceVersion,
    String createdAt,
    String updatedAt) {

  public static NotificationRequestResponse from(NotificationRequest request) {
    return new NotificationRequestResponse(
        request.id(),
        request.labels(),
        request.spec(),
        request.status(),
        request.resourceVersion(),
        request.createdAt() == null ? null : request.createdAt().toString(),
        request.updatedAt() == null ? null : request.updatedAt().toString());
  }
}
