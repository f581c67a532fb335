package com.example.notifier.channel;

/** Thrown by a channel when it can already tell how the failure should be treated. */
public class DeliveryException extends RuntimeException {

  private final transient DeliveryFailure failure;

  public DeliveryException(DeliveryFailure failure) {
    super(failure.reason());
    this.failure = failure;
  }

  public DeliveryException(DeliveryFailure failure, Throwable cause) {
    super(failure.reason(), cause);
    this.failure = failure;
  }

  public DeliveryFailure failure() {
    return failure;
  }
}
