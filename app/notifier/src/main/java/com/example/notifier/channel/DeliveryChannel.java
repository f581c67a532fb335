/*
 * Where: Notifier channels
 * What: Contract every delivery channel implements
 * Why: The reconciler treats console, file and webhook endpoints uniformly
 */
package com.example.notifier.channel;

public interface DeliveryChannel {

  String name();

  /** Whether a request must name at least one recipient for this channel. */
  default boolean requiresRecipients() {
    return false;
  }

  /**
   * Delivers the payload or throws. Implementations should throw {@link DeliveryException} when
   * they can classify the failure themselves.
   */
  void deliver(DeliveryPayload payload);

  /** Maps an exception raised by {@link #deliver} to a retry decision. */
  default DeliveryFailure classify(Throwable error) {
    if (error instanceof DeliveryException deliveryException) {
      return deliveryException.failure();
    }
    final String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    return DeliveryFailure.retryable(message);
  }
}
