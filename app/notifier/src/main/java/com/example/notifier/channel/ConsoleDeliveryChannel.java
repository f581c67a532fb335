/*
 * Where: Notifier channels
 * What: Writes the notification as a structured log line
 * Why: Always-available channel for local runs and as the routing fallback
 */
package com.example.notifier.channel;

import static net.logstash.logback.argument.StructuredArguments.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConsoleDeliveryChannel implements DeliveryChannel {

  public static final String NAME = "console";

  private static final Logger output = LoggerFactory.getLogger("notifier.channel.console");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void deliver(DeliveryPayload payload) {
    output.info(
        "notification {} {} {} {}",
        kv("notification_id", payload.notificationId()),
        kv("priority", payload.priority() == null ? null : payload.priority().value()),
        kv("subject", payload.subject()),
        kv("body", payload.body()));
  }
}
