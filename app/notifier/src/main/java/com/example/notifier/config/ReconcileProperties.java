/*
 * Where: Notifier configuration binding
 * What: Reconcile worker pool, resync cadence and requeue settings
 * Why: Throughput and recovery latency are tuned per deployment
 */
package com.example.notifier.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.reconcile")
@Validated
public record ReconcileProperties(
    boolean enabled,
    @Positive int workerThreads,
    @Positive int queueCapacity,
    @NotNull Duration resyncInterval,
    @Positive int resyncBatchSize,
    @NotNull Duration errorRequeueDelay,
    @NotNull Duration shutdownGrace) {}
