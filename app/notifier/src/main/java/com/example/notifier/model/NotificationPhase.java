/*
 * Where: Notifier domain model
 * What: Lifecycle phases of a notification request
 * Why: Sent, PartiallySent and Failed are absorbing; nothing moves a request out of them
 */
package com.example.notifier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum NotificationPhase {
  PENDING("Pending"),
  SENDING("Sending"),
  SENT("Sent"),
  PARTIALLY_SENT("PartiallySent"),
  FAILED("Failed");

  private final String value;

  NotificationPhase(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == SENT || this == PARTIALLY_SENT || this == FAILED;
  }

  @JsonCreator
  public static NotificationPhase fromValue(String value) {
    return Arrays.stream(values())
        .filter(phase -> phase.value.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown phase: " + value));
  }
}
