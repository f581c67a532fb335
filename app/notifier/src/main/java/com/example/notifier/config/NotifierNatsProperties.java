/*
 * Where: Notifier configuration binding
 * What: JetStream settings for request change events (subject/stream/durable/duplicate-window/ack-wait/max-deliver)
 * Why: Tune redelivery per environment and reject broken values at startup
 */
package com.example.notifier.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notifier.nats")
@Validated
public record NotifierNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "notifier.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return DurationChecks.isPositive(duplicateWindow);
  }

  @AssertTrue(message = "notifier.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return DurationChecks.isPositive(ackWait);
  }
}
