/*
 * Where: Notifier NATS integration
 * What: Publishes request change events to JetStream
 * Why: Any replica subscribed to the stream can pick up the reconcile
 */
package com.example.notifier.nats;

import com.example.common.CorrelationIds;
import com.example.notifier.config.NotifierNatsProperties;
import com.example.notifier.service.NotificationRequestEventPublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsNotificationRequestEventPublisher implements NotificationRequestEventPublisher {

  private final JetStream jetStream;
  private final NotifierNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public NatsNotificationRequestEventPublisher(
      JetStream jetStream,
      NotifierNatsProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void publishChanged(UUID notificationId, String changeType) {
    if (notificationId == null) {
      throw new IllegalArgumentException("notificationId is required");
    }
    final String eventId = UUID.randomUUID().toString();
    final NotificationRequestChangedEvent event =
        new NotificationRequestChangedEvent(
            eventId,
            changeType,
            Instant.now(clock).toString(),
            notificationId.toString(),
            CorrelationIds.resolve(null));
    final Headers headers = new Headers();
    // JetStream drops duplicates with the same Nats-Msg-Id inside the duplicate window.
    headers.add("Nats-Msg-Id", eventId);
    try {
      jetStream.publish(
          properties.subject(),
          headers,
          objectMapper.writeValueAsString(event).getBytes(StandardCharsets.UTF_8));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode notification request event", ex);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish notification request event", ex);
    }
  }
}
