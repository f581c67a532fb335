/*
 * Where: Notifier audit
 * What: Builds audit events for message sent/failed and request completion
 * Why: Keeps event naming and retention in one place; payload text is sanitized here
 */
package com.example.notifier.audit;

import com.example.notifier.config.AuditProperties;
import com.example.notifier.model.DeliveryAttempt;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.sanitizer.Sanitizer;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditEventFactory {

  public static final String TYPE_MESSAGE_SENT = "notification.message.sent";
  public static final String TYPE_MESSAGE_FAILED = "notification.message.failed";
  public static final String TYPE_REQUEST_COMPLETED = "notification.request.completed";

  private static final String CATEGORY = "notification";
  private static final String ACTOR_TYPE = "service";
  private static final String RESOURCE_TYPE = "NotificationRequest";

  private final AuditProperties properties;
  private final Sanitizer sanitizer;
  private final Clock clock;

  public AuditEvent messageSent(NotificationRequest request, DeliveryAttempt attempt, String subject) {
    final Map<String, Object> data = attemptData(request, attempt);
    data.put("subject", subject);
    return event(request, TYPE_MESSAGE_SENT, "deliver", "success", data);
  }

  public AuditEvent messageFailed(NotificationRequest request, DeliveryAttempt attempt) {
    final Map<String, Object> data = attemptData(request, attempt);
    data.put("failure_kind", attempt.failureKind() == null ? null : attempt.failureKind().name());
    data.put("error", sanitizer.sanitize(attempt.error()).text());
    data.put("terminal", attempt.terminal());
    return event(request, TYPE_MESSAGE_FAILED, "deliver", "failure", data);
  }

  public AuditEvent requestCompleted(NotificationRequest request) {
    final NotificationRequestStatus status = request.status();
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("notification_id", request.id().toString());
    data.put("phase", status.phase().value());
    data.put("reason", status.reason());
    data.put("total_attempts", status.totalAttempts());
    data.put("successful_deliveries", status.successfulDeliveries());
    data.put("failed_deliveries", status.failedDeliveries());
    data.put("channels", request.spec().channels());
    final String outcome =
        switch (status.phase()) {
          case SENT -> "success";
          case PARTIALLY_SENT -> "partial";
          default -> "failure";
        };
    return event(request, TYPE_REQUEST_COMPLETED, "complete", outcome, data);
  }

  private Map<String, Object> attemptData(NotificationRequest request, DeliveryAttempt attempt) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("notification_id", request.id().toString());
    data.put("channel", attempt.channel());
    data.put("attempt", attempt.attempt());
    data.put("duration_ms", attempt.durationMillis());
    if (request.spec().priority() != null) {
      data.put("priority", request.spec().priority().value());
    }
    return data;
  }

  private AuditEvent event(
      NotificationRequest request,
      String eventType,
      String action,
      String outcome,
      Map<String, Object> data) {
    // Map.copyOf rejects null values.
    data.values().removeIf(value -> value == null);
    return new AuditEvent(
        UUID.randomUUID(),
        eventType,
        CATEGORY,
        action,
        outcome,
        ACTOR_TYPE,
        properties.actorId(),
        RESOURCE_TYPE,
        request.id().toString(),
        request.spec().correlationId(),
        Instant.now(clock),
        properties.retentionDays(),
        data);
  }
}
