package com.example.notifier.service;

import com.example.notifier.model.DeliveryAttempt;

/**
 * @param attempt the recorded attempt, or null when the append was discarded
 * @param discard why the append was discarded, or null when it was recorded
 */
public record AppendResult(DeliveryAttempt attempt, Discard discard) {

  /** Reasons an attempt is not recorded. */
  public enum Discard {
    /** The channel (or the whole request) was already resolved. */
    RESOLVED,
    /** Another invocation recorded an attempt for the channel after this one read the status. */
    SUPERSEDED
  }

  static AppendResult recorded(DeliveryAttempt attempt) {
    return new AppendResult(attempt, null);
  }

  static AppendResult discarded(Discard discard) {
    return new AppendResult(null, discard);
  }

  public boolean appended() {
    return attempt != null;
  }
}
