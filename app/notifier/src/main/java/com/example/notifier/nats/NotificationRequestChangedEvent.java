package com.example.notifier.nats;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** JSON body of a change event on the request subject. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequestChangedEvent(
    String eventId, String eventType, String occurredAt, String notificationId, String correlationId) {}
