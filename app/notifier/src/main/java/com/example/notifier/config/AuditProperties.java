/*
 * Where: Notifier configuration binding
 * What: Audit buffer, sink endpoint, dead-letter replay and retention settings
 * Why: Audit delivery must be tunable without touching the delivery path
 */
package com.example.notifier.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.audit")
@Validated
public record AuditProperties(
    boolean enabled,
    String baseUrl,
    @NotBlank String path,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @Positive int bufferCapacity,
    @Positive int overflowCapacity,
    @Positive int batchSize,
    @NotNull Duration flushInterval,
    @NotNull Duration shutdownGrace,
    @NotNull Duration replayInterval,
    @Positive int replayBatchSize,
    @Positive int retentionDays,
    @NotBlank String actorId) {}
