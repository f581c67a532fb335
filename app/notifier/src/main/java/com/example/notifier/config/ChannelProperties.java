/*
 * Where: Notifier configuration binding
 * What: Enabled delivery channels and their endpoints
 * Why: Channel names in requests resolve against this set; anything else is unsupported
 */
package com.example.notifier.config;

import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifier.channels")
public record ChannelProperties(Console console, FileChannel file, Map<String, Webhook> webhooks) {

  public ChannelProperties {
    console = console == null ? new Console(true) : console;
    file = file == null ? new FileChannel(false, null) : file;
    webhooks = webhooks == null ? Map.of() : Map.copyOf(webhooks);
  }

  public record Console(boolean enabled) {}

  public record FileChannel(boolean enabled, String directory) {}

  /**
   * HTTP endpoint channel. The map key becomes the channel name, e.g. {@code slack}.
   */
  public record Webhook(
      String url, Duration connectTimeout, Duration readTimeout, Map<String, String> headers) {

    public Webhook {
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
      headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
  }
}
