package com.example.notifier.config;

import java.time.Duration;

final class DurationChecks {
  private DurationChecks() {}

  // null is left to @NotNull.
  static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
