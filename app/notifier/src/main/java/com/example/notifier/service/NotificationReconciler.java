/*
 * Where: Notifier delivery core
 * What: Drives one notification request toward a terminal phase
 * Why: Level-triggered and idempotent; it may run repeatedly or concurrently for the same request
 */
package com.example.notifier.service;

import com.example.common.CorrelationIds;
import com.example.notifier.audit.AuditEmitter;
import com.example.notifier.audit.AuditEventFactory;
import com.example.notifier.channel.ChannelCircuitBreakers;
import com.example.notifier.channel.ChannelDispatcher;
import com.example.notifier.channel.DeliveryChannel;
import com.example.notifier.channel.DeliveryChannelRegistry;
import com.example.notifier.channel.DeliveryFailure;
import com.example.notifier.channel.DeliveryPayload;
import com.example.notifier.channel.DispatchResult;
import com.example.notifier.config.NotificationDeliveryProperties;
import com.example.notifier.model.ChannelState;
import com.example.notifier.model.DeliveryAttempt;
import com.example.notifier.model.FailureKind;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.sanitizer.SanitizationResult;
import com.example.notifier.sanitizer.Sanitizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationReconciler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationReconciler.class);
  static final String MDC_NOTIFICATION_ID = "notification_id";

  private final NotificationStatusManager statusManager;
  private final Sanitizer sanitizer;
  private final DeliveryChannelRegistry channelRegistry;
  private final ChannelCircuitBreakers circuitBreakers;
  private final ChannelDispatcher dispatcher;
  private final AuditEmitter auditEmitter;
  private final AuditEventFactory auditEventFactory;
  private final NotifierMetrics metrics;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;

  public ReconcileResult reconcile(UUID notificationId) {
    final long startedAt = System.nanoTime();
    try (MDC.MDCCloseable ignored =
        MDC.putCloseable(MDC_NOTIFICATION_ID, notificationId.toString())) {
      return reconcileLoaded(notificationId);
    } catch (NotificationRequestNotFoundException ex) {
      // Deleted mid-flight: nothing left to converge.
      logger.info("notification request disappeared during reconcile id={}", notificationId);
      return ReconcileResult.done();
    } finally {
      metrics.recordReconcileDuration(Duration.ofNanos(System.nanoTime() - startedAt));
    }
  }

  private ReconcileResult reconcileLoaded(UUID id) {
    final Optional<NotificationRequest> loaded = statusManager.load(id);
    if (loaded.isEmpty()) {
      logger.debug("notification request not found; nothing to reconcile id={}", id);
      return ReconcileResult.done();
    }
    NotificationRequest request = loaded.get();
    if (request.status().phase().isTerminal()) {
      return ReconcileResult.done();
    }
    final String correlationId =
        request.spec().correlationId() == null ? id.toString() : request.spec().correlationId();
    try (MDC.MDCCloseable ignored = MDC.putCloseable(CorrelationIds.MDC_KEY, correlationId)) {
      if (request.status().phase() == NotificationPhase.PENDING) {
        request = statusManager.markSending(id);
        if (request.status().phase() == NotificationPhase.SENDING) {
          metrics.recordRequestPhase(NotificationPhase.SENDING);
        }
      }
      if (request.status().phase().isTerminal()) {
        return ReconcileResult.done();
      }
      final RetryPolicy policy =
          RetryPolicy.from(properties).overriddenBy(request.spec().retryPolicy());
      final SanitizedContent content = sanitize(request);
      final Instant now = Instant.now(clock);
      for (String channel : request.spec().channels()) {
        reconcileChannel(request, channel, content, policy, now);
      }
      final PhaseTransition transition = statusManager.refreshPhase(id);
      if (transition.completedNow()) {
        onCompleted(transition.request());
      }
      if (transition.current().isTerminal()) {
        return ReconcileResult.done();
      }
      return ReconcileResult.after(untilNextDue(transition.request(), Instant.now(clock)));
    }
  }

  private void reconcileChannel(
      NotificationRequest request,
      String channel,
      SanitizedContent content,
      RetryPolicy policy,
      Instant now) {
    final NotificationRequestStatus status = request.status();
    if (status.channelState(channel).isResolved()) {
      return;
    }
    final Optional<DeliveryAttempt> last = status.lastAttemptFor(channel);
    if (last.isPresent()
        && last.get().nextRetryAt() != null
        && now.isBefore(last.get().nextRetryAt())) {
      logger.debug(
          "channel not due yet channel={} nextRetryAt={}", channel, last.get().nextRetryAt());
      return;
    }
    final int observedAttempts = status.attemptsFor(channel).size();
    final ChannelOutcome outcome = attempt(request, channel, content);
    final AppendResult appended =
        statusManager.appendAttempt(request.id(), outcome, policy, observedAttempts);
    if (appended.discard() == AppendResult.Discard.SUPERSEDED) {
      logger.info(
          "delivery attempt discarded; another reconcile recorded this channel first channel={} kind={}",
          channel,
          outcome.failureKind());
      return;
    }
    if (!appended.appended()) {
      logger.info(
          "delivery attempt discarded; channel already resolved channel={} outcome={}",
          channel,
          outcome.outcome());
      return;
    }
    try {
      afterRecorded(request, appended.attempt(), content, outcome);
    } catch (RuntimeException ex) {
      logger.warn("post-delivery bookkeeping failed channel={}", channel, ex);
    }
  }

  private ChannelOutcome attempt(
      NotificationRequest request, String channel, SanitizedContent content) {
    final Instant startedAt = Instant.now(clock);
    final Optional<DeliveryChannel> resolved = channelRegistry.find(channel);
    if (resolved.isEmpty()) {
      return ChannelOutcome.failure(
          channel,
          DeliveryFailure.permanent("unsupported channel: " + channel),
          Duration.ZERO,
          startedAt);
    }
    final DeliveryChannel target = resolved.get();
    final List<String> recipients = request.spec().recipientsFor(channel);
    if (target.requiresRecipients() && recipients.isEmpty()) {
      return ChannelOutcome.failure(
          channel,
          DeliveryFailure.permanent("no recipients configured for channel " + channel),
          Duration.ZERO,
          startedAt);
    }
    if (!circuitBreakers.allow(channel)) {
      return ChannelOutcome.failure(
          channel, DeliveryFailure.circuitOpen(channel), Duration.ZERO, startedAt);
    }
    final DeliveryPayload payload =
        new DeliveryPayload(
            request.id(),
            channel,
            content.subject(),
            content.body(),
            request.spec().priority(),
            recipients,
            request.spec().correlationId());
    final DispatchResult result = dispatcher.dispatch(target, payload);
    if (result.succeeded()) {
      circuitBreakers.recordSuccess(channel, result.duration());
      return ChannelOutcome.success(channel, result.duration(), startedAt);
    }
    circuitBreakers.recordFailure(channel, result.duration(), result.error());
    return ChannelOutcome.failure(channel, result.failure(), result.duration(), startedAt);
  }

  private void afterRecorded(
      NotificationRequest request,
      DeliveryAttempt attempt,
      SanitizedContent content,
      ChannelOutcome outcome) {
    final String channel = attempt.channel();
    metrics.recordDeliveryAttempt(channel, outcomeTag(attempt));
    if (outcome.duration() != null && !outcome.duration().isZero()) {
      metrics.recordDeliveryDuration(channel, outcome.duration());
    }
    if (attempt.succeeded()) {
      logger.info(
          "notification delivered channel={} attempt={} durationMs={}",
          channel,
          attempt.attempt(),
          attempt.durationMillis());
      auditEmitter.emit(auditEventFactory.messageSent(request, attempt, content.subject()));
      return;
    }
    if (attempt.terminal()) {
      logger.warn(
          "notification delivery failed terminally channel={} attempt={} kind={} error={}",
          channel,
          attempt.attempt(),
          attempt.failureKind(),
          attempt.error());
    } else {
      metrics.recordRetryScheduled(channel);
      logger.warn(
          "notification delivery failed; retry scheduled channel={} attempt={} kind={} nextRetryAt={} error={}",
          channel,
          attempt.attempt(),
          attempt.failureKind(),
          attempt.nextRetryAt(),
          attempt.error());
    }
    auditEmitter.emit(auditEventFactory.messageFailed(request, attempt));
  }

  private void onCompleted(NotificationRequest request) {
    final NotificationRequestStatus status = request.status();
    metrics.recordRequestPhase(status.phase());
    logger.info(
        "notification request completed phase={} reason={} succeeded={} failed={}",
        status.phase().value(),
        status.reason(),
        status.successfulDeliveries(),
        status.failedDeliveries());
    auditEmitter.emit(auditEventFactory.requestCompleted(request));
  }

  private SanitizedContent sanitize(NotificationRequest request) {
    final SanitizationResult subject = sanitizer.sanitize(request.spec().subject());
    final SanitizationResult body = sanitizer.sanitize(request.spec().body());
    if (subject.degraded() || body.degraded()) {
      statusManager.markSanitizationDegraded(
          request.id(), "secret pattern matching failed; coarse redaction applied");
    }
    return new SanitizedContent(subject.text(), body.text());
  }

  private Duration untilNextDue(NotificationRequest request, Instant now) {
    Duration soonest = null;
    final NotificationRequestStatus status = request.status();
    for (String channel : request.spec().channels()) {
      if (status.channelState(channel) != ChannelState.PENDING) {
        continue;
      }
      final Instant due =
          status.lastAttemptFor(channel).map(DeliveryAttempt::nextRetryAt).orElse(now);
      Duration wait = Duration.between(now, due == null ? now : due);
      if (wait.isNegative()) {
        wait = Duration.ZERO;
      }
      if (soonest == null || wait.compareTo(soonest) < 0) {
        soonest = wait;
      }
    }
    return soonest == null ? Duration.ZERO : soonest;
  }

  private String outcomeTag(DeliveryAttempt attempt) {
    if (attempt.succeeded()) {
      return "success";
    }
    if (attempt.failureKind() == FailureKind.CIRCUIT_OPEN) {
      return "circuit_open";
    }
    if (attempt.failureKind() == FailureKind.PERMANENT) {
      return "permanent";
    }
    return "failed";
  }

  private record SanitizedContent(String subject, String body) {}
}
