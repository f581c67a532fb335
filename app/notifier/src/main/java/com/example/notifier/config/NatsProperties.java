/*
 * Where: Notifier configuration binding
 * What: NATS connection settings
 * Why: Switch the broker per environment, or run without one
 */
package com.example.notifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
