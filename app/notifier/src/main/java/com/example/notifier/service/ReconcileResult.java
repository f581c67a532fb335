package com.example.notifier.service;

import java.time.Duration;

/**
 * @param requeueAfter delay before the request should be reconciled again; null when done
 */
public record ReconcileResult(Duration requeueAfter) {

  public static ReconcileResult done() {
    return new ReconcileResult(null);
  }

  public static ReconcileResult after(Duration delay) {
    return new ReconcileResult(delay.isNegative() ? Duration.ZERO : delay);
  }

  public boolean requeue() {
    return requeueAfter != null;
  }
}
