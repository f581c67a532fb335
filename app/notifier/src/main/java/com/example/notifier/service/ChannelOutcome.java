package com.example.notifier.service;

import com.example.notifier.channel.DeliveryFailure;
import com.example.notifier.model.AttemptOutcome;
import com.example.notifier.model.FailureKind;
import java.time.Duration;
import java.time.Instant;

/** Result of trying one channel once, before it is numbered and recorded. */
public record ChannelOutcome(
    String channel,
    AttemptOutcome outcome,
    FailureKind failureKind,
    String error,
    Duration duration,
    Duration retryAfter,
    Instant timestamp) {

  public static ChannelOutcome success(String channel, Duration duration, Instant timestamp) {
    return new ChannelOutcome(
        channel, AttemptOutcome.SUCCESS, null, null, duration, null, timestamp);
  }

  public static ChannelOutcome failure(
      String channel, DeliveryFailure failure, Duration duration, Instant timestamp) {
    return new ChannelOutcome(
        channel,
        AttemptOutcome.FAILED,
        failure.kind(),
        failure.reason(),
        duration,
        failure.retryAfter(),
        timestamp);
  }

  public boolean permanent() {
    return failureKind == FailureKind.PERMANENT;
  }
}
