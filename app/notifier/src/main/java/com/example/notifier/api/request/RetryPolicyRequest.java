package com.example.notifier.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetryPolicyRequest(
    @Min(value = 1, message = "max_attempts must be between 1 and 10")
        @Max(value = 10, message = "max_attempts must be between 1 and 10")
        Integer maxAttempts,
    @Min(value = 1, message = "initial_backoff_seconds must be between 1 and 300")
        @Max(value = 300, message = "initial_backoff_seconds must be between 1 and 300")
        Long initialBackoffSeconds,
    @DecimalMin(value = "1.0", message = "backoff_multiplier must be between 1.0 and 10.0")
        @DecimalMax(value = "10.0", message = "backoff_multiplier must be between 1.0 and 10.0")
        Double backoffMultiplier,
    @Min(value = 1, message = "max_backoff_seconds must be between 1 and 3600")
        @Max(value = 3600, message = "max_backoff_seconds must be between 1 and 3600")
        Long maxBackoffSeconds) {

  @AssertTrue(message = "max_backoff_seconds must not be less than initial_backoff_seconds")
  public boolean isBackoffRangeValid() {
    if (initialBackoffSeconds == null || maxBackoffSeconds == null) {
      return true;
    }
    return maxBackoffSeconds >= initialBackoffSeconds;
  }
}
