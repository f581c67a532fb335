/*
 * Where: Notifier infrastructure configuration
 * What: Puts the NATS connection and its JetStream context under Spring management
 * Why: Publisher and subscriber share one connection
 */
package com.example.notifier.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .connectionName("notifier")
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection natsConnection) throws IOException {
    return natsConnection.jetStream();
  }
}
