/*
 * Where: Notifier configuration
 * What: Builds the enabled delivery channels from notifier.channels
 * Why: Each webhook gets its own RestClient so timeouts are scoped per provider
 */
package com.example.notifier.config;

import com.example.notifier.channel.ConsoleDeliveryChannel;
import com.example.notifier.channel.DeliveryChannel;
import com.example.notifier.channel.DeliveryChannelRegistry;
import com.example.notifier.channel.FileDeliveryChannel;
import com.example.notifier.channel.WebhookDeliveryChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class DeliveryChannelConfig {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryChannelConfig.class);

  @Bean
  DeliveryChannelRegistry deliveryChannelRegistry(
      ChannelProperties properties,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper,
      Clock clock) {
    final List<DeliveryChannel> channels = new ArrayList<>();
    if (properties.console().enabled()) {
      channels.add(new ConsoleDeliveryChannel());
    }
    if (properties.file().enabled()) {
      channels.add(new FileDeliveryChannel(outputDirectory(properties.file()), objectMapper, clock));
    }
    for (Map.Entry<String, ChannelProperties.Webhook> entry : properties.webhooks().entrySet()) {
      final ChannelProperties.Webhook webhook = entry.getValue();
      if (webhook.url() == null || webhook.url().isBlank()) {
        throw new IllegalStateException("notifier.channels.webhooks." + entry.getKey() + ".url is required");
      }
      channels.add(
          new WebhookDeliveryChannel(
              entry.getKey(),
              restClientBuilder.clone().requestFactory(requestFactory(webhook)).build(),
              webhook.url(),
              webhook.headers(),
              clock));
    }
    final DeliveryChannelRegistry registry = new DeliveryChannelRegistry(channels);
    logger.info("delivery channels enabled names={}", registry.names());
    return registry;
  }

  private Path outputDirectory(ChannelProperties.FileChannel file) {
    if (file.directory() == null || file.directory().isBlank()) {
      throw new IllegalStateException("notifier.channels.file.directory is required when enabled");
    }
    final Path directory = Path.of(file.directory());
    try {
      Files.createDirectories(directory);
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to prepare file channel directory " + directory, ex);
    }
    return directory;
  }

  private SimpleClientHttpRequestFactory requestFactory(ChannelProperties.Webhook webhook) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(webhook.connectTimeout());
    factory.setReadTimeout(webhook.readTimeout());
    return factory;
  }
}
