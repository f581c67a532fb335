package com.example.notifier.model;

/** Why an attempt failed; drives whether the channel is retried. */
public enum FailureKind {
  RETRYABLE,
  PERMANENT,
  CIRCUIT_OPEN
}
