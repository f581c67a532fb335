package com.example.notifier.channel;

import java.time.Duration;

public record DispatchResult(DeliveryFailure failure, Throwable error, Duration duration) {

  public static DispatchResult success(Duration duration) {
    return new DispatchResult(null, null, duration);
  }

  public static DispatchResult failed(DeliveryFailure failure, Throwable error, Duration duration) {
    return new DispatchResult(failure, error, duration);
  }

  public boolean succeeded() {
    return failure == null;
  }
}
