/*
 * Where: Notifier routing
 * What: Picks channels for a request that names none, from its labels
 * Why: Operators own the severity/team to channel mapping instead of every caller
 */
package com.example.notifier.routing;

import com.example.notifier.config.RoutingProperties;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChannelRouter {

  private final RoutingProperties properties;

  /** First matching rule wins; rules with an empty match never match. */
  public RoutingDecision resolve(Map<String, String> labels) {
    final Map<String, String> safeLabels = labels == null ? Map.of() : labels;
    for (RoutingProperties.Rule rule : properties.rules()) {
      if (matches(rule, safeLabels) && !rule.channels().isEmpty()) {
        return new RoutingDecision(
            rule.channels(),
            RoutingDecision.REASON_RULE_MATCHED,
            "matched routing rule " + (rule.name() == null ? "<unnamed>" : rule.name()));
      }
    }
    if (!properties.fallbackChannels().isEmpty()) {
      return new RoutingDecision(
          properties.fallbackChannels(),
          RoutingDecision.REASON_FALLBACK,
          "no routing rule matched; using fallback channels");
    }
    return new RoutingDecision(
        null, RoutingDecision.REASON_FAILED, "no routing rule matched and no fallback configured");
  }

  private boolean matches(RoutingProperties.Rule rule, Map<String, String> labels) {
    if (rule.match().isEmpty()) {
      return false;
    }
    return rule.match().entrySet().stream()
        .allMatch(entry -> Objects.equals(labels.get(entry.getKey()), entry.getValue()));
  }
}
