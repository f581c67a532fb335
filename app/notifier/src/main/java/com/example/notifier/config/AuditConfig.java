/*
 * Where: Notifier configuration
 * What: Wires the audit emitter, HTTP sink and dead-letter replay
 * Why: Audit can be switched off per environment without touching the reconciler
 */
package com.example.notifier.config;

import com.example.notifier.audit.AuditDeadLetterReplayService;
import com.example.notifier.audit.AuditDeadLetterReplayWorker;
import com.example.notifier.audit.AuditEmitter;
import com.example.notifier.audit.AuditSink;
import com.example.notifier.audit.BufferedAuditEmitter;
import com.example.notifier.audit.HttpAuditSink;
import com.example.notifier.audit.NoopAuditEmitter;
import com.example.notifier.repository.AuditDeadLetterRepository;
import com.example.notifier.service.NotifierMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AuditConfig {

  @Configuration
  @ConditionalOnProperty(name = "notifier.audit.enabled", havingValue = "true")
  static class EnabledAuditConfig {

    @Bean
    AuditSink auditSink(RestClient.Builder builder, AuditProperties properties) {
      if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
        throw new IllegalStateException("notifier.audit.base-url is required when audit is enabled");
      }
      final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
      requestFactory.setConnectTimeout(properties.connectTimeout());
      requestFactory.setReadTimeout(properties.readTimeout());
      final RestClient restClient =
          builder.clone().baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
      return new HttpAuditSink(restClient, properties.path());
    }

    @Bean
    AuditEmitter auditEmitter(
        AuditSink auditSink,
        AuditDeadLetterRepository deadLetterRepository,
        ObjectMapper objectMapper,
        AuditProperties properties,
        NotifierMetrics metrics,
        Clock clock) {
      return new BufferedAuditEmitter(
          auditSink, deadLetterRepository, objectMapper, properties, metrics, clock);
    }

    @Bean
    AuditDeadLetterReplayService auditDeadLetterReplayService(
        AuditDeadLetterRepository deadLetterRepository,
        AuditSink auditSink,
        ObjectMapper objectMapper,
        AuditProperties properties,
        NotifierMetrics metrics,
        Clock clock) {
      return new AuditDeadLetterReplayService(
          deadLetterRepository, auditSink, objectMapper, properties, metrics, clock);
    }

    @Bean
    AuditDeadLetterReplayWorker auditDeadLetterReplayWorker(
        AuditDeadLetterReplayService replayService) {
      return new AuditDeadLetterReplayWorker(replayService);
    }
  }

  @Bean
  @ConditionalOnProperty(name = "notifier.audit.enabled", havingValue = "false", matchIfMissing = true)
  AuditEmitter noopAuditEmitter() {
    return new NoopAuditEmitter();
  }
}
