/*
 * Where: Notifier NATS integration
 * What: Consumes request change events and enqueues the reconcile
 * Why: Reacting to events keeps delivery latency low; resync covers anything missed
 */
package com.example.notifier.nats;

import com.example.notifier.config.NotifierNatsProperties;
import com.example.notifier.service.ReconcileQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationRequestEventSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(NotificationRequestEventSubscriber.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private final Connection connection;
    private final ReconcileQueue reconcileQueue;
    private final NotifierNatsProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public NotificationRequestEventSubscriber(Connection connection,
            ReconcileQueue reconcileQueue,
            NotifierNatsProperties properties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.reconcileQueue = reconcileQueue;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("notification request subscriber started subject={} stream={} durable={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        try {
            NotificationRequestChangedEvent event =
                    objectMapper.readValue(message.getData(), NotificationRequestChangedEvent.class);
            UUID notificationId = parseNotificationId(event);
            reconcileQueue.enqueue(notificationId);
            // Enqueue is enough; the reconcile itself is level-triggered.
            message.ack();
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            // A malformed payload will not parse on redelivery either.
            logger.warn("dropping malformed notification request event", ex);
            termSilently(message);
        } catch (IOException ex) {
            logger.warn("failed to read notification request event", ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            logger.warn("failed to handle notification request event", ex);
            nakSilently(message);
        }
    }

    private UUID parseNotificationId(NotificationRequestChangedEvent event) {
        if (event == null || event.notificationId() == null || event.notificationId().isBlank()) {
            throw new IllegalArgumentException("notification_id is required");
        }
        return UUID.fromString(event.notificationId());
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // The stream must exist for Nats-Msg-Id deduplication to apply.
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        upsertStream(jetStreamManagement, streamConfiguration);
        logger.info("notification request stream ensured stream={} subject={} duplicateWindow={}",
                properties.stream(),
                properties.subject(),
                properties.duplicateWindow());
    }

    private void upsertStream(JetStreamManagement jetStreamManagement,
            StreamConfiguration streamConfiguration) throws IOException, JetStreamApiException {
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }

    private boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nak nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
