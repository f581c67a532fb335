/*
 * Where: Notifier status manager unit tests
 * What: Attempt numbering, idempotent appends, phase derivation and conflict handling
 * Why: Every status write goes through this class, so duplicate or lost attempts start here
 */
package com.example.notifier.service;

import static com.example.notifier.service.NotificationFixtures.NOW;
import static com.example.notifier.service.NotificationFixtures.deliveryProperties;
import static com.example.notifier.service.NotificationFixtures.pendingRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.notifier.channel.DeliveryFailure;
import com.example.notifier.model.ChannelState;
import com.example.notifier.model.Condition;
import com.example.notifier.model.DeliveryAttempt;
import com.example.notifier.model.FailureKind;
import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestStatus;
import com.example.notifier.repository.NotificationRequestStore;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationStatusManagerTest {

  // 0.5 maps to a zero jitter offset, so delays are exact.
  private static final double NO_JITTER = 0.5d;

  private InMemoryNotificationRequestStore store;
  private NotificationStatusManager manager;
  private RetryPolicy policy;

  @BeforeEach
  void setUp() {
    store = new InMemoryNotificationRequestStore();
    manager =
        new NotificationStatusManager(
            store, deliveryProperties(3), Clock.fixed(NOW, ZoneOffset.UTC), () -> NO_JITTER);
    policy = RetryPolicy.defaults();
  }

  @Test
  void markSendingMovesPendingToSendingOnce() {
    final NotificationRequest request = pendingRequest(List.of("console"));
    store.insert(request);

    final NotificationRequest first = manager.markSending(request.id());
    final NotificationRequest second = manager.markSending(request.id());

    assertThat(first.status().phase()).isEqualTo(NotificationPhase.SENDING);
    assertThat(second.resourceVersion()).isEqualTo(first.resourceVersion());
    assertThat(store.successfulWrites()).isEqualTo(1);
  }

  @Test
  void appendAttemptNumbersAttemptsPerChannelAndSchedulesRetry() {
    final NotificationRequest request = pendingRequest(List.of("console", "slack"));
    store.insert(request);

    final AppendResult first =
        manager.appendAttempt(request.id(), retryable("slack", "http 503"), policy, 0);
    final AppendResult console =
        manager.appendAttempt(
            request.id(), ChannelOutcome.success("console", Duration.ofMillis(3), NOW), policy, 0);

    assertThat(first.appended()).isTrue();
    assertThat(first.attempt().attempt()).isEqualTo(1);
    assertThat(first.attempt().terminal()).isFalse();
    assertThat(first.attempt().nextRetryAt()).isEqualTo(NOW.plusSeconds(30));
    assertThat(console.attempt().attempt()).isEqualTo(1);

    final NotificationRequestStatus status = manager.load(request.id()).orElseThrow().status();
    assertThat(status.totalAttempts()).isEqualTo(2);
    assertThat(status.successfulDeliveries()).isEqualTo(1);
    assertThat(status.failedDeliveries()).isZero();
  }

  @Test
  void appendAttemptIsDiscardedOnceChannelSucceeded() {
    final NotificationRequest request = pendingRequest(List.of("console"));
    store.insert(request);
    final ChannelOutcome success = ChannelOutcome.success("console", Duration.ofMillis(5), NOW);

    final AppendResult first = manager.appendAttempt(request.id(), success, policy, 0);
    final AppendResult repeated = manager.appendAttempt(request.id(), success, policy, 0);
    final AppendResult lateFailure =
        manager.appendAttempt(request.id(), retryable("console", "late timeout"), policy, 1);

    assertThat(first.appended()).isTrue();
    assertThat(repeated.appended()).isFalse();
    assertThat(repeated.discard()).isEqualTo(AppendResult.Discard.RESOLVED);
    assertThat(lateFailure.appended()).isFalse();
    assertThat(manager.load(request.id()).orElseThrow().status().deliveryAttempts()).hasSize(1);
  }

  @Test
  void appendAttemptIsDiscardedWhenRequestIsTerminal() {
    final NotificationRequest request = pendingRequest(List.of("console"));
    store.insert(request);
    manager.appendAttempt(
        request.id(), ChannelOutcome.success("console", Duration.ofMillis(5), NOW), policy, 0);
    assertThat(manager.refreshPhase(request.id()).current()).isEqualTo(NotificationPhase.SENT);

    final AppendResult result =
        manager.appendAttempt(
            request.id(), retryable("slack", "not part of the request"), policy, 0);

    assertThat(result.appended()).isFalse();
  }

  @Test
  void fifthRetryableFailureIsTerminal() {
    final NotificationRequest request = pendingRequest(List.of("pager"));
    store.insert(request);

    DeliveryAttempt last = null;
    for (int i = 0; i < 5; i++) {
      final ChannelOutcome outcome =
          ChannelOutcome.failure(
              "pager",
              DeliveryFailure.retryable("http 503"),
              Duration.ofMillis(10),
              NOW.plus(Duration.ofHours(i)));
      last = manager.appendAttempt(request.id(), outcome, policy, i).attempt();
    }

    assertThat(last.attempt()).isEqualTo(5);
    assertThat(last.terminal()).isTrue();
    assertThat(last.nextRetryAt()).isNull();
    final PhaseTransition transition = manager.refreshPhase(request.id());
    assertThat(transition.current()).isEqualTo(NotificationPhase.FAILED);
    assertThat(transition.completedNow()).isTrue();
    assertThat(transition.request().status().completionTime()).isEqualTo(NOW);
  }

  @Test
  void permanentFailureIsTerminalOnFirstAttempt() {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);

    final DeliveryAttempt attempt =
        manager
            .appendAttempt(
                request.id(),
                ChannelOutcome.failure(
                    "slack", DeliveryFailure.permanent("http 401"), Duration.ofMillis(20), NOW),
                policy,
                0)
            .attempt();

    assertThat(attempt.terminal()).isTrue();
    assertThat(attempt.failureKind()).isEqualTo(FailureKind.PERMANENT);
  }

  @Test
  void retryAfterHintLongerThanBackoffWins() {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);
    final ChannelOutcome throttled =
        ChannelOutcome.failure(
            "slack",
            DeliveryFailure.retryable("http 429", Duration.ofSeconds(300)),
            Duration.ofMillis(20),
            NOW);

    final DeliveryAttempt attempt = manager.appendAttempt(request.id(), throttled, policy, 0).attempt();

    assertThat(attempt.nextRetryAt()).isEqualTo(NOW.plusSeconds(300));
  }

  @Test
  void errorMessagesAreTruncated() {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);

    final DeliveryAttempt attempt =
        manager
            .appendAttempt(request.id(), retryable("slack", "x".repeat(500)), policy, 0)
            .attempt();

    assertThat(attempt.error()).hasSize(200);
  }

  @Test
  void refreshPhaseDerivesPartiallySentAndStaysTerminal() {
    final NotificationRequest request = pendingRequest(List.of("console", "slack"));
    store.insert(request);
    manager.markSending(request.id());
    manager.appendAttempt(
        request.id(), ChannelOutcome.success("console", Duration.ofMillis(5), NOW), policy, 0);
    assertThat(manager.refreshPhase(request.id()).current()).isEqualTo(NotificationPhase.SENDING);
    manager.appendAttempt(
        request.id(),
        ChannelOutcome.failure("slack", DeliveryFailure.permanent("http 401"), Duration.ZERO, NOW),
        policy,
        0);

    final PhaseTransition completed = manager.refreshPhase(request.id());
    final PhaseTransition again = manager.refreshPhase(request.id());

    assertThat(completed.current()).isEqualTo(NotificationPhase.PARTIALLY_SENT);
    assertThat(completed.completedNow()).isTrue();
    assertThat(completed.request().status().reason())
        .isEqualTo(NotificationStatusManager.REASON_PARTIAL_FAILURE);
    assertThat(again.completedNow()).isFalse();
    assertThat(again.current()).isEqualTo(NotificationPhase.PARTIALLY_SENT);
  }

  @Test
  void decideFailsRequestWithoutChannels() {
    final NotificationStatusManager.PhaseDecision decision =
        NotificationStatusManager.decide(List.of(), NotificationRequestStatus.pending(List.of()));

    assertThat(decision.phase()).isEqualTo(NotificationPhase.FAILED);
    assertThat(decision.reason()).isEqualTo(NotificationStatusManager.REASON_NO_CHANNELS);
  }

  @Test
  void markSanitizationDegradedAddsConditionOnce() {
    final NotificationRequest request = pendingRequest(List.of("console"));
    store.insert(request);

    manager.markSanitizationDegraded(request.id(), "coarse redaction applied");
    manager.markSanitizationDegraded(request.id(), "coarse redaction applied");

    final Optional<Condition> condition =
        manager
            .load(request.id())
            .orElseThrow()
            .status()
            .condition(Condition.TYPE_SANITIZATION_DEGRADED);
    assertThat(condition).isPresent();
    assertThat(condition.get().status()).isEqualTo(Condition.STATUS_TRUE);
    assertThat(store.successfulWrites()).isEqualTo(1);
  }

  @Test
  void missingRequestRaisesNotFound() {
    final UUID id = UUID.randomUUID();

    assertThatThrownBy(() -> manager.markSending(id))
        .isInstanceOf(NotificationRequestNotFoundException.class);
  }

  @Test
  void persistentConflictsGiveUpAfterConfiguredAttempts() {
    final NotificationRequestStore conflictingStore = mock(NotificationRequestStore.class);
    final NotificationRequest request = pendingRequest(List.of("console"));
    when(conflictingStore.findById(request.id())).thenReturn(Optional.of(request));
    when(conflictingStore.compareAndSetStatus(eq(request.id()), anyLong(), any(), any()))
        .thenReturn(false);
    final NotificationStatusManager conflicted =
        new NotificationStatusManager(
            conflictingStore,
            deliveryProperties(3),
            Clock.fixed(NOW, ZoneOffset.UTC),
            () -> NO_JITTER);

    assertThatThrownBy(() -> conflicted.markSending(request.id()))
        .isInstanceOf(StatusConflictException.class);
    verify(conflictingStore, times(3))
        .compareAndSetStatus(eq(request.id()), anyLong(), any(), any());
  }

  @Test
  void concurrentSuccessfulAppendsRecordExactlyOneAttempt() throws Exception {
    final NotificationRequest request = pendingRequest(List.of("console"));
    store.insert(request);
    final NotificationStatusManager contended =
        new NotificationStatusManager(
            store, deliveryProperties(10), Clock.fixed(NOW, ZoneOffset.UTC), () -> NO_JITTER);
    final int workers = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<AppendResult>> futures = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return contended.appendAttempt(
                      request.id(),
                      ChannelOutcome.success("console", Duration.ofMillis(1), NOW),
                      policy,
                      0);
                }));
      }
      start.countDown();
      int appended = 0;
      for (Future<AppendResult> future : futures) {
        if (future.get(10, TimeUnit.SECONDS).appended()) {
          appended++;
        }
      }

      assertThat(appended).isEqualTo(1);
      final NotificationRequestStatus status = store.findById(request.id()).orElseThrow().status();
      assertThat(status.deliveryAttempts()).hasSize(1);
      assertThat(status.successfulDeliveries()).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void failureObservedAgainstStaleAttemptCountIsSuperseded() {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);
    manager.appendAttempt(request.id(), retryable("slack", "http 503"), policy, 0);

    final AppendResult stale =
        manager.appendAttempt(request.id(), retryable("slack", "http 503"), policy, 0);

    assertThat(stale.appended()).isFalse();
    assertThat(stale.discard()).isEqualTo(AppendResult.Discard.SUPERSEDED);
    assertThat(manager.load(request.id()).orElseThrow().status().deliveryAttempts()).hasSize(1);
  }

  @Test
  void failureBeforeScheduledRetryIsSuperseded() {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);
    manager.appendAttempt(request.id(), retryable("slack", "http 503"), policy, 0);

    final AppendResult early =
        manager.appendAttempt(
            request.id(),
            ChannelOutcome.failure(
                "slack",
                DeliveryFailure.retryable("http 503"),
                Duration.ofMillis(10),
                NOW.plusSeconds(10)),
            policy,
            1);
    final AppendResult due =
        manager.appendAttempt(
            request.id(),
            ChannelOutcome.failure(
                "slack",
                DeliveryFailure.retryable("http 503"),
                Duration.ofMillis(10),
                NOW.plusSeconds(30)),
            policy,
            1);

    assertThat(early.discard()).isEqualTo(AppendResult.Discard.SUPERSEDED);
    assertThat(due.attempt().attempt()).isEqualTo(2);
    assertThat(due.attempt().nextRetryAt()).isEqualTo(NOW.plusSeconds(90));
  }

  @Test
  void successIsRecordedEvenWhenAConcurrentFailureLandedFirst() {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);
    manager.appendAttempt(
        request.id(),
        ChannelOutcome.failure(
            "slack", DeliveryFailure.circuitOpen("slack"), Duration.ZERO, NOW),
        policy,
        0);

    final AppendResult delivered =
        manager.appendAttempt(
            request.id(), ChannelOutcome.success("slack", Duration.ofMillis(8), NOW), policy, 0);

    assertThat(delivered.appended()).isTrue();
    assertThat(delivered.attempt().attempt()).isEqualTo(2);
    assertThat(manager.load(request.id()).orElseThrow().status().channelState("slack"))
        .isEqualTo(ChannelState.SUCCEEDED);
  }

  @Test
  void concurrentFailedAppendsSpendOneAttempt() throws Exception {
    final NotificationRequest request = pendingRequest(List.of("slack"));
    store.insert(request);
    final NotificationStatusManager contended =
        new NotificationStatusManager(
            store, deliveryProperties(10), Clock.fixed(NOW, ZoneOffset.UTC), () -> NO_JITTER);
    final int workers = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(workers);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<AppendResult>> futures = new ArrayList<>();
      for (int i = 0; i < workers; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return contended.appendAttempt(
                      request.id(), retryable("slack", "http 503"), policy, 0);
                }));
      }
      start.countDown();
      int appended = 0;
      for (Future<AppendResult> future : futures) {
        if (future.get(10, TimeUnit.SECONDS).appended()) {
          appended++;
        }
      }

      assertThat(appended).isEqualTo(1);
      final DeliveryAttempt only =
          store.findById(request.id()).orElseThrow().status().lastAttemptFor("slack").orElseThrow();
      assertThat(only.attempt()).isEqualTo(1);
      assertThat(only.nextRetryAt()).isEqualTo(NOW.plusSeconds(30));
    } finally {
      executor.shutdownNow();
    }
  }

  private ChannelOutcome retryable(String channel, String error) {
    return ChannelOutcome.failure(
        channel, DeliveryFailure.retryable(error), Duration.ofMillis(10), NOW);
  }
}
