package com.example.notifier.channel;

import com.example.notifier.model.Priority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

/** Already-sanitized content handed to a channel. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryPayload(
    UUID notificationId,
    String channel,
    String subject,
    String body,
    Priority priority,
    List<String> recipients,
    String correlationId) {

  public DeliveryPayload {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }
}
