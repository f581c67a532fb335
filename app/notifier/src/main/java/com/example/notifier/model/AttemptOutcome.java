package com.example.notifier.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AttemptOutcome {
  SUCCESS,
  FAILED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
