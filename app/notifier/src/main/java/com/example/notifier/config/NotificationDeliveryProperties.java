/*
 * Where: Notifier configuration binding
 * What: Delivery timeout, default retry policy and status write settings
 * Why: Requests without a retry override fall back to these values
 */
package com.example.notifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.delivery")
@Validated
public record NotificationDeliveryProperties(
    @NotNull Duration timeout,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    @DecimalMin("1.0") double backoffExponentBase,
    @DecimalMin("0.0") @DecimalMax("1.0") double backoffJitterRatio,
    @Positive int errorMessageMaxLength,
    @Positive int statusUpdateMaxRetries,
    @Positive int workerThreads) {

  @AssertTrue(message = "notifier.delivery.backoff-max must not be shorter than backoff-base")
  public boolean isBackoffRangeValid() {
    if (backoffBase == null || backoffMax == null) {
      return true;
    }
    return DurationChecks.isPositive(backoffBase) && backoffMax.compareTo(backoffBase) >= 0;
  }

  @AssertTrue(message = "notifier.delivery.timeout must be positive")
  public boolean isTimeoutPositive() {
    return DurationChecks.isPositive(timeout);
  }
}
