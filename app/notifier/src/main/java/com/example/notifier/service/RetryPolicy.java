/*
 * Where: Notifier delivery core
 * What: Exponential backoff with a cap, optional jitter and provider retry hints
 * Why: Pure functions of the attempt number so schedules are reproducible in tests
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationDeliveryProperties;
import com.example.notifier.model.RetryPolicySpec;
import java.time.Duration;

public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff,
    double jitterRatio) {

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(30);
  public static final double DEFAULT_MULTIPLIER = 2.0d;
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(480);
  public static final double DEFAULT_JITTER_RATIO = 0.1d;

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalArgumentException("initialBackoff must be positive");
    }
    if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
    }
    if (backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
    }
    if (jitterRatio < 0.0d || jitterRatio > 1.0d) {
      throw new IllegalArgumentException("jitterRatio must be within [0, 1]");
    }
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(
        DEFAULT_MAX_ATTEMPTS,
        DEFAULT_INITIAL_BACKOFF,
        DEFAULT_MULTIPLIER,
        DEFAULT_MAX_BACKOFF,
        DEFAULT_JITTER_RATIO);
  }

  public static RetryPolicy from(NotificationDeliveryProperties properties) {
    return new RetryPolicy(
        properties.maxAttempts(),
        properties.backoffBase(),
        properties.backoffExponentBase(),
        properties.backoffMax(),
        properties.backoffJitterRatio());
  }

  /** Overlays the non-null fields of a request override onto this policy. */
  public RetryPolicy overriddenBy(RetryPolicySpec spec) {
    if (spec == null) {
      return this;
    }
    final Duration initial =
        spec.initialBackoffSeconds() == null
            ? initialBackoff
            : Duration.ofSeconds(spec.initialBackoffSeconds());
    Duration max =
        spec.maxBackoffSeconds() == null ? maxBackoff : Duration.ofSeconds(spec.maxBackoffSeconds());
    if (max.compareTo(initial) < 0) {
      max = initial;
    }
    return new RetryPolicy(
        spec.maxAttempts() == null ? maxAttempts : spec.maxAttempts(),
        initial,
        spec.backoffMultiplier() == null ? backoffMultiplier : spec.backoffMultiplier(),
        max,
        jitterRatio);
  }

  /** Delay after the given attempt, before jitter: {@code min(initial * multiplier^(n-1), max)}. */
  public Duration nextDelay(int attemptNumber) {
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be at least 1");
    }
    final double baseMillis = initialBackoff.toMillis();
    final double exp = baseMillis * Math.pow(backoffMultiplier, attemptNumber - 1);
    final double capped = Math.min(exp, maxBackoff.toMillis());
    return Duration.ofMillis((long) Math.ceil(capped));
  }

  public boolean isExhausted(int attemptNumber) {
    return attemptNumber >= maxAttempts;
  }

  /**
   * Spreads {@code delay} by up to {@code jitterRatio} either way, clamped to [initial, max].
   *
   * @param unitRandom a value in [0, 1)
   */
  public Duration applyJitter(Duration delay, double unitRandom) {
    if (jitterRatio <= 0.0d) {
      return delay;
    }
    final double offset = delay.toMillis() * jitterRatio * (2.0d * unitRandom - 1.0d);
    final long jittered = Math.round(delay.toMillis() + offset);
    final long clamped =
        Math.max(initialBackoff.toMillis(), Math.min(maxBackoff.toMillis(), jittered));
    return Duration.ofMillis(clamped);
  }

  /** Jittered delay after the given attempt; a larger provider hint takes precedence. */
  public Duration retryDelay(int attemptNumber, Duration retryAfterHint, double unitRandom) {
    final Duration computed = applyJitter(nextDelay(attemptNumber), unitRandom);
    if (retryAfterHint != null && retryAfterHint.compareTo(computed) > 0) {
      return retryAfterHint;
    }
    return computed;
  }
}
