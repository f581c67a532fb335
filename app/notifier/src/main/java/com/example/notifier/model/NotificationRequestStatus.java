/*
 * Where: Notifier domain model
 * What: Observed state of a notification request
 * Why: Counters and phase are always derived from the attempt list so they cannot drift from it
 */
package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequestStatus(
    NotificationPhase phase,
    List<DeliveryAttempt> deliveryAttempts,
    int totalAttempts,
    int successfulDeliveries,
    int failedDeliveries,
    List<Condition> conditions,
    String reason,
    String message,
    Instant completionTime) {

  public NotificationRequestStatus {
    phase = phase == null ? NotificationPhase.PENDING : phase;
    deliveryAttempts = deliveryAttempts == null ? List.of() : List.copyOf(deliveryAttempts);
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  public static NotificationRequestStatus pending(List<Condition> conditions) {
    return new NotificationRequestStatus(
        NotificationPhase.PENDING, List.of(), 0, 0, 0, conditions, "Created", null, null);
  }

  public List<DeliveryAttempt> attemptsFor(String channel) {
    return deliveryAttempts.stream().filter(attempt -> channel.equals(attempt.channel())).toList();
  }

  public Optional<DeliveryAttempt> lastAttemptFor(String channel) {
    final List<DeliveryAttempt> attempts = attemptsFor(channel);
    return attempts.isEmpty() ? Optional.empty() : Optional.of(attempts.get(attempts.size() - 1));
  }

  public ChannelState channelState(String channel) {
    ChannelState state = ChannelState.PENDING;
    for (DeliveryAttempt attempt : attemptsFor(channel)) {
      if (attempt.succeeded()) {
        return ChannelState.SUCCEEDED;
      }
      if (attempt.terminal()) {
        state = ChannelState.FAILED;
      }
    }
    return state;
  }

  public Optional<Condition> condition(String type) {
    return conditions.stream().filter(condition -> type.equals(condition.type())).findFirst();
  }

  public NotificationRequestStatus withAttempt(DeliveryAttempt attempt) {
    final List<DeliveryAttempt> attempts = new ArrayList<>(deliveryAttempts);
    attempts.add(attempt);
    final NotificationRequestStatus appended =
        new NotificationRequestStatus(
            phase, attempts, 0, 0, 0, conditions, reason, message, completionTime);
    final List<String> channels =
        attempts.stream().map(DeliveryAttempt::channel).distinct().toList();
    int succeeded = 0;
    int failed = 0;
    for (String channel : channels) {
      final ChannelState state = appended.channelState(channel);
      if (state == ChannelState.SUCCEEDED) {
        succeeded++;
      } else if (state == ChannelState.FAILED) {
        failed++;
      }
    }
    return new NotificationRequestStatus(
        phase, attempts, attempts.size(), succeeded, failed, conditions, reason, message,
        completionTime);
  }

  public NotificationRequestStatus withPhase(
      NotificationPhase nextPhase, String nextReason, String nextMessage, Instant completedAt) {
    return new NotificationRequestStatus(
        nextPhase,
        deliveryAttempts,
        totalAttempts,
        successfulDeliveries,
        failedDeliveries,
        conditions,
        nextReason,
        nextMessage,
        completedAt);
  }

  /** Replaces any existing condition of the same type. */
  public NotificationRequestStatus withCondition(Condition condition) {
    final List<Condition> updated = new ArrayList<>();
    for (Condition existing : conditions) {
      if (!existing.type().equals(condition.type())) {
        updated.add(existing);
      }
    }
    updated.add(condition);
    return new NotificationRequestStatus(
        phase,
        deliveryAttempts,
        totalAttempts,
        successfulDeliveries,
        failedDeliveries,
        updated,
        reason,
        message,
        completionTime);
  }
}
