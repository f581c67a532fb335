/*
 * Where: Notifier domain model
 * What: Desired state of a notification request, immutable after admission
 * Why: The reconciler only ever reads the spec; progress lives in the status
 */
package com.example.notifier.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequestSpec(
    String subject,
    String body,
    Priority priority,
    List<String> channels,
    List<Recipient> recipients,
    RetryPolicySpec retryPolicy,
    String correlationId) {

  public NotificationRequestSpec {
    channels = channels == null ? List.of() : List.copyOf(channels);
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }

  public List<String> recipientsFor(String channel) {
    return recipients.stream()
        .filter(recipient -> channel.equals(recipient.channel()))
        .map(Recipient::address)
        .filter(address -> address != null && !address.isBlank())
        .toList();
  }

  public NotificationRequestSpec withChannels(List<String> resolvedChannels) {
    return new NotificationRequestSpec(
        subject, body, priority, resolvedChannels, recipients, retryPolicy, correlationId);
  }
}
