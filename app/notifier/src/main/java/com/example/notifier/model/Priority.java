package com.example.notifier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Priority {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Priority fromValue(String value) {
    if (value == null) {
      return null;
    }
    return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
