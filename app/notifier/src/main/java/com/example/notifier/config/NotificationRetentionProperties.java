/*
 * Where: Notifier configuration binding
 * What: Retention cleanup settings for finished requests and audit dead letters
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.notifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifier.retention")
public record NotificationRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
