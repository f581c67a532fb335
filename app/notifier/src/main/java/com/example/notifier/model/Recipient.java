package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Channel-scoped destination address, e.g. a Slack channel id or an email address. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Recipient(String channel, String address) {}
