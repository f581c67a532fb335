/*
 * Where: Notifier configuration binding
 * What: Label-based routing rules used when a request names no channels
 * Why: Callers can tag a request by severity or team and let operators pick the channels
 */
package com.example.notifier.config;

import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifier.routing")
public record RoutingProperties(List<Rule> rules, List<String> fallbackChannels) {

  public RoutingProperties {
    rules = rules == null ? List.of() : List.copyOf(rules);
    fallbackChannels = fallbackChannels == null ? List.of("console") : List.copyOf(fallbackChannels);
  }

  /** Matches when every entry of {@code match} is present in the request labels. */
  public record Rule(String name, Map<String, String> match, List<String> channels) {

    public Rule {
      match = match == null ? Map.of() : Map.copyOf(match);
      channels = channels == null ? List.of() : List.copyOf(channels);
    }
  }
}
