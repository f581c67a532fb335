/*
 * Where: Notifier configuration binding
 * What: Per-channel circuit breaker thresholds
 * Why: Failure threshold and cooldown differ between local and production providers
 */
package com.example.notifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.circuit-breaker")
@Validated
public record CircuitBreakerProperties(@Positive int failureThreshold, @NotNull Duration cooldown) {

  @AssertTrue(message = "notifier.circuit-breaker.cooldown must be positive")
  public boolean isCooldownPositive() {
    return DurationChecks.isPositive(cooldown);
  }
}
