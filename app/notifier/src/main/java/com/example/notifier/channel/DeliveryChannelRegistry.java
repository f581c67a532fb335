package com.example.notifier.channel;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Enabled channels by name. */
public class DeliveryChannelRegistry {

  private final Map<String, DeliveryChannel> channels;

  public DeliveryChannelRegistry(Collection<? extends DeliveryChannel> channels) {
    final Map<String, DeliveryChannel> byName = new LinkedHashMap<>();
    for (DeliveryChannel channel : channels) {
      if (byName.putIfAbsent(channel.name(), channel) != null) {
        throw new IllegalStateException("duplicate delivery channel: " + channel.name());
      }
    }
    this.channels = Map.copyOf(byName);
  }

  public Optional<DeliveryChannel> find(String name) {
    return Optional.ofNullable(channels.get(name));
  }

  public Set<String> names() {
    return channels.keySet();
  }
}
