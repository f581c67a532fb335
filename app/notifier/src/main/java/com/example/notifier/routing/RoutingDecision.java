package com.example.notifier.routing;

import java.util.List;

/**
 * @param reason {@code RuleMatched}, {@code Fallback} or {@code Failed}
 */
public record RoutingDecision(List<String> channels, String reason, String message) {

  public static final String REASON_RULE_MATCHED = "RuleMatched";
  public static final String REASON_FALLBACK = "Fallback";
  public static final String REASON_FAILED = "Failed";

  public RoutingDecision {
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public boolean resolved() {
    return !channels.isEmpty();
  }
}
