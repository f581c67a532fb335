/*
 * Where: Notifier application service
 * What: Admits, reads and lists notification requests
 * Why: Routing and retry overrides are settled once at admission so reconciles never revisit them
 */
package com.example.notifier.service;

import com.example.common.CorrelationIds;
import com.example.notifier.api.request.CreateNotificationRequest;
import com.example.notifier.api.request.RecipientRequest;
import com.example.notifier.api.request.RetryPolicyRequest;
import com.example.notifier.config.NotificationDeliveryProperties;
import com.example.notifier.model.Condition;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestSpec;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.model.Recipient;
import com.example.notifier.model.RetryPolicySpec;
import com.example.notifier.repository.NotificationRequestRepository;
import com.example.notifier.routing.ChannelRouter;
import com.example.notifier.routing.RoutingDecision;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRequestService {

  static final String CHANGE_CREATED = "created";
  static final int MAX_LIST_LIMIT = 200;

  private static final Logger logger = LoggerFactory.getLogger(NotificationRequestService.class);

  private final NotificationRequestRepository repository;
  private final ChannelRouter channelRouter;
  private final NotificationRequestEventPublisher eventPublisher;
  private final ReconcileQueue reconcileQueue;
  private final NotifierMetrics metrics;
  private final NotificationDeliveryProperties deliveryProperties;
  private final Clock clock;

  public NotificationRequest create(CreateNotificationRequest request) {
    final Instant now = Instant.now(clock);
    final Map<String, String> labels = request.labels() == null ? Map.of() : request.labels();
    final List<Condition> conditions = new ArrayList<>();
    List<String> channels = distinctChannels(request.channels());
    if (channels.isEmpty()) {
      final RoutingDecision decision = channelRouter.resolve(labels);
      conditions.add(
          new Condition(
              Condition.TYPE_ROUTING_RESOLVED,
              decision.resolved() ? Condition.STATUS_TRUE : Condition.STATUS_FALSE,
              decision.reason(),
              decision.message(),
              now));
      if (!decision.resolved()) {
        throw new InvalidNotificationRequestException(
            "no channels requested and routing resolved none: " + decision.message());
      }
      channels = decision.channels();
    }
    final RetryPolicySpec retryPolicy = toRetryPolicySpec(request.retryPolicy());
    validateRetryPolicy(retryPolicy);

    final NotificationRequestSpec spec =
        new NotificationRequestSpec(
            request.subject(),
            request.body(),
            request.priority(),
            channels,
            toRecipients(request.recipients()),
            retryPolicy,
            CorrelationIds.resolve(request.correlationId()));
    final NotificationRequest created =
        new NotificationRequest(
            UUID.randomUUID(),
            labels,
            spec,
            NotificationRequestStatus.pending(conditions),
            1L,
            now,
            now);
    repository.insert(created);
    metrics.recordRequestPhase(NotificationPhase.PENDING);
    logger.info(
        "notification request admitted id={} channels={} correlationId={}",
        created.id(),
        channels,
        spec.correlationId());
    announce(created.id());
    return created;
  }

  public NotificationRequest get(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new NotificationRequestNotFoundException(id));
  }

  public List<NotificationRequest> list(NotificationPhase phase, int limit) {
    final int boundedLimit = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
    if (phase == null) {
      return repository.findRecent(boundedLimit);
    }
    return repository.findByPhase(phase, boundedLimit);
  }

  private void announce(UUID id) {
    try {
      eventPublisher.publishChanged(id, CHANGE_CREATED);
    } catch (RuntimeException ex) {
      // The row is committed; a local reconcile keeps the request moving.
      logger.warn("change event publish failed; reconciling locally id={}", id, ex);
      reconcileQueue.enqueue(id);
    }
  }

  private List<String> distinctChannels(List<String> requested) {
    if (requested == null) {
      return List.of();
    }
    final Set<String> seen = new HashSet<>();
    for (String channel : requested) {
      if (!seen.add(channel)) {
        throw new InvalidNotificationRequestException("duplicate channel: " + channel);
      }
    }
    return List.copyOf(requested);
  }

  private List<Recipient> toRecipients(List<RecipientRequest> recipients) {
    if (recipients == null) {
      return List.of();
    }
    return recipients.stream()
        .map(recipient -> new Recipient(recipient.channel(), recipient.address()))
        .toList();
  }

  private RetryPolicySpec toRetryPolicySpec(RetryPolicyRequest retryPolicy) {
    if (retryPolicy == null) {
      return null;
    }
    return new RetryPolicySpec(
        retryPolicy.maxAttempts(),
        retryPolicy.initialBackoffSeconds(),
        retryPolicy.backoffMultiplier(),
        retryPolicy.maxBackoffSeconds());
  }

  private void validateRetryPolicy(RetryPolicySpec retryPolicy) {
    try {
      RetryPolicy.from(deliveryProperties).overriddenBy(retryPolicy);
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationRequestException("retry_policy is invalid: " + ex.getMessage());
    }
  }
}
