/*
 * Where: Notifier API request model
 * What: Body of POST /v1/notification-requests
 * Why: Shape and bounds are validated before anything is stored
 */
package com.example.notifier.api.request;

import com.example.notifier.model.Priority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateNotificationRequest(
    @NotBlank(message = "subject is required") @Size(max = 500, message = "subject is too long")
        String subject,
    @NotBlank(message = "body is required") @Size(max = 20000, message = "body is too long")
        String body,
    @NotNull(message = "priority is required") Priority priority,
    List<@NotBlank(message = "channel names must not be blank") String> channels,
    List<@Valid RecipientRequest> recipients,
    @Valid RetryPolicyRequest retryPolicy,
    Map<String, String> labels,
    @Size(max = 128, message = "correlation_id is too long") String correlationId) {}
