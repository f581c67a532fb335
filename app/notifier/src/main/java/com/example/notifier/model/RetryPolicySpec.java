package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-request retry override. Any field left null falls back to the controller default.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetryPolicySpec(
    Integer maxAttempts,
    Long initialBackoffSeconds,
    Double backoffMultiplier,
    Long maxBackoffSeconds) {}
