/*
 * Where: Notifier service layer
 * What: Single writer of notification request status (attempt appends, phase, conditions)
 * Why: Every write is read-modify-compare-and-set so concurrent reconciles never duplicate or lose an attempt
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationDeliveryProperties;
import com.example.notifier.model.AttemptOutcome;
import com.example.notifier.model.ChannelState;
import com.example.notifier.model.Condition;
import com.example.notifier.model.DeliveryAttempt;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.repository.NotificationRequestStore;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class NotificationStatusManager {

  private static final Logger logger = LoggerFactory.getLogger(NotificationStatusManager.class);

  static final String REASON_PROCESSING = "ProcessingDeliveries";
  static final String REASON_ALL_SUCCEEDED = "AllDeliveriesSucceeded";
  static final String REASON_PARTIAL_FAILURE = "PartialDeliveryFailure";
  static final String REASON_ALL_FAILED = "AllDeliveriesFailed";
  static final String REASON_NO_CHANNELS = "NoChannels";
  static final String REASON_FALLBACK_REDACTION = "FallbackRedaction";

  private final NotificationRequestStore store;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;
  private final DoubleSupplier jitterSource;

  @Autowired
  public NotificationStatusManager(
      NotificationRequestStore store, NotificationDeliveryProperties properties, Clock clock) {
    this(store, properties, clock, () -> ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  NotificationStatusManager(
      NotificationRequestStore store,
      NotificationDeliveryProperties properties,
      Clock clock,
      DoubleSupplier jitterSource) {
    this.store = store;
    this.properties = properties;
    this.clock = clock;
    this.jitterSource = jitterSource;
  }

  public Optional<NotificationRequest> load(UUID id) {
    return store.findById(id);
  }

  /** Moves a Pending request to Sending; any other phase is left untouched. */
  public NotificationRequest markSending(UUID id) {
    return update(
        id,
        "markSending",
        current -> {
          if (current.status().phase() != NotificationPhase.PENDING) {
            return Mutation.skip(Function.identity());
          }
          return Mutation.write(
              current
                  .status()
                  .withPhase(
                      NotificationPhase.SENDING,
                      REASON_PROCESSING,
                      "dispatching to " + current.spec().channels().size() + " channel(s)",
                      null),
              Function.identity());
        });
  }

  /**
   * Numbers and records one attempt for a channel.
   *
   * <p>The append is discarded when the channel already has a terminal attempt or the request is
   * already in a terminal phase, so a repeated call for the same logical attempt never produces a
   * second record. {@code observedAttempts} is the number of attempts for the channel the caller
   * saw before dispatching. A failure is discarded as superseded when the stored count has moved
   * past it or the last stored attempt is not yet due, so overlapping invocations spend one unit
   * of retry budget between them. A success is still recorded since the delivery did happen.
   */
  public AppendResult appendAttempt(
      UUID id, ChannelOutcome outcome, RetryPolicy policy, int observedAttempts) {
    return update(
        id,
        "appendAttempt",
        current -> {
          final NotificationRequestStatus status = current.status();
          if (status.phase().isTerminal()
              || status.channelState(outcome.channel()).isResolved()) {
            return Mutation.skip(ignored -> AppendResult.discarded(AppendResult.Discard.RESOLVED));
          }
          if (outcome.outcome() != AttemptOutcome.SUCCESS
              && supersededBy(status.attemptsFor(outcome.channel()), outcome, observedAttempts)) {
            return Mutation.skip(
                ignored -> AppendResult.discarded(AppendResult.Discard.SUPERSEDED));
          }
          final DeliveryAttempt attempt = numberAttempt(status, outcome, policy);
          return Mutation.write(
              status.withAttempt(attempt), ignored -> AppendResult.recorded(attempt));
        });
  }

  /**
   * Recomputes the phase from per-channel progress. Terminal phases are never left; entering one
   * stamps the completion time.
   */
  public PhaseTransition refreshPhase(UUID id) {
    return update(
        id,
        "refreshPhase",
        current -> {
          final NotificationRequestStatus status = current.status();
          final NotificationPhase previous = status.phase();
          if (previous.isTerminal()) {
            return Mutation.skip(request -> new PhaseTransition(previous, request));
          }
          final PhaseDecision decision = decide(current.spec().channels(), status);
          if (decision.phase() == previous
              && Objects.equals(decision.reason(), status.reason())
              && Objects.equals(decision.message(), status.message())) {
            return Mutation.skip(request -> new PhaseTransition(previous, request));
          }
          final Instant completionTime =
              decision.phase().isTerminal() ? Instant.now(clock) : null;
          return Mutation.write(
              status.withPhase(
                  decision.phase(), decision.reason(), decision.message(), completionTime),
              request -> new PhaseTransition(previous, request));
        });
  }

  public NotificationRequest markSanitizationDegraded(UUID id, String message) {
    return update(
        id,
        "markSanitizationDegraded",
        current -> {
          final Optional<Condition> existing =
              current.status().condition(Condition.TYPE_SANITIZATION_DEGRADED);
          if (existing.isPresent() && Condition.STATUS_TRUE.equals(existing.get().status())) {
            return Mutation.skip(Function.identity());
          }
          final Condition condition =
              new Condition(
                  Condition.TYPE_SANITIZATION_DEGRADED,
                  Condition.STATUS_TRUE,
                  REASON_FALLBACK_REDACTION,
                  message,
                  Instant.now(clock));
          return Mutation.write(current.status().withCondition(condition), Function.identity());
        });
  }

  private static boolean supersededBy(
      List<DeliveryAttempt> stored, ChannelOutcome outcome, int observedAttempts) {
    if (stored.size() != observedAttempts) {
      return true;
    }
    if (stored.isEmpty()) {
      return false;
    }
    final Instant nextRetryAt = stored.get(stored.size() - 1).nextRetryAt();
    return nextRetryAt != null && nextRetryAt.isAfter(outcome.timestamp());
  }

  private DeliveryAttempt numberAttempt(
      NotificationRequestStatus status, ChannelOutcome outcome, RetryPolicy policy) {
    final int attemptNumber = status.attemptsFor(outcome.channel()).size() + 1;
    final boolean succeeded = outcome.outcome() == AttemptOutcome.SUCCESS;
    final boolean terminal = succeeded || outcome.permanent() || policy.isExhausted(attemptNumber);
    final Instant nextRetryAt =
        terminal
            ? null
            : outcome
                .timestamp()
                .plus(
                    policy.retryDelay(
                        attemptNumber, outcome.retryAfter(), jitterSource.getAsDouble()));
    return new DeliveryAttempt(
        outcome.channel(),
        attemptNumber,
        outcome.timestamp(),
        outcome.outcome(),
        outcome.failureKind(),
        succeeded ? null : truncateError(outcome.error()),
        outcome.duration() == null ? 0L : outcome.duration().toMillis(),
        terminal,
        nextRetryAt);
  }

  @VisibleForTesting
  static PhaseDecision decide(List<String> channels, NotificationRequestStatus status) {
    if (channels.isEmpty()) {
      return new PhaseDecision(NotificationPhase.FAILED, REASON_NO_CHANNELS, "no channels to deliver to");
    }
    int succeeded = 0;
    int pending = 0;
    for (String channel : channels) {
      final ChannelState state = status.channelState(channel);
      if (state == ChannelState.SUCCEEDED) {
        succeeded++;
      } else if (state == ChannelState.PENDING) {
        pending++;
      }
    }
    final int total = channels.size();
    if (pending > 0) {
      return new PhaseDecision(
          NotificationPhase.SENDING,
          REASON_PROCESSING,
          pending + " of " + total + " channel(s) pending");
    }
    if (succeeded == total) {
      return new PhaseDecision(
          NotificationPhase.SENT, REASON_ALL_SUCCEEDED, "delivered to " + total + " channel(s)");
    }
    if (succeeded > 0) {
      return new PhaseDecision(
          NotificationPhase.PARTIALLY_SENT,
          REASON_PARTIAL_FAILURE,
          "delivered to " + succeeded + " of " + total + " channel(s)");
    }
    return new PhaseDecision(
        NotificationPhase.FAILED, REASON_ALL_FAILED, "all " + total + " channel(s) failed");
  }

  private <T> T update(
      UUID id, String operation, Function<NotificationRequest, Mutation<T>> mutation) {
    final int maxAttempts = properties.statusUpdateMaxRetries();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      final NotificationRequest current =
          store.findById(id).orElseThrow(() -> new NotificationRequestNotFoundException(id));
      final Mutation<T> change = mutation.apply(current);
      if (change.status() == null) {
        return change.result().apply(current);
      }
      final Instant now = Instant.now(clock);
      if (store.compareAndSetStatus(id, current.resourceVersion(), change.status(), now)) {
        return change
            .result()
            .apply(current.withStatus(change.status(), current.resourceVersion() + 1, now));
      }
      logger.debug(
          "status write lost compare-and-set id={} operation={} attempt={}", id, operation, attempt);
    }
    throw new StatusConflictException(id, operation, maxAttempts);
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  record PhaseDecision(NotificationPhase phase, String reason, String message) {}

  private record Mutation<T>(
      NotificationRequestStatus status, Function<NotificationRequest, T> result) {

    static <T> Mutation<T> write(
        NotificationRequestStatus status, Function<NotificationRequest, T> result) {
      return new Mutation<>(status, result);
    }

    static <T> Mutation<T> skip(Function<NotificationRequest, T> result) {
      return new Mutation<>(null, result);
    }
  }
}
