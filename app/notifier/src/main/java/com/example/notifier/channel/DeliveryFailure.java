package com.example.notifier.channel;

import com.example.notifier.model.FailureKind;
import java.time.Duration;

/**
 * Classified delivery failure.
 *
 * @param retryAfter provider back-off hint, or null
 */
public record DeliveryFailure(FailureKind kind, String reason, Duration retryAfter) {

  public static DeliveryFailure retryable(String reason) {
    return new DeliveryFailure(FailureKind.RETRYABLE, reason, null);
  }

  public static DeliveryFailure retryable(String reason, Duration retryAfter) {
    return new DeliveryFailure(FailureKind.RETRYABLE, reason, retryAfter);
  }

  public static DeliveryFailure permanent(String reason) {
    return new DeliveryFailure(FailureKind.PERMANENT, reason, null);
  }

  public static DeliveryFailure circuitOpen(String channel) {
    return new DeliveryFailure(
        FailureKind.CIRCUIT_OPEN, "circuit breaker open for channel " + channel, null);
  }

  public boolean isPermanent() {
    return kind == FailureKind.PERMANENT;
  }
}
