package com.example.notifier.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipientRequest(
    @NotBlank(message = "recipient channel is required") String channel,
    @NotBlank(message = "recipient address is required") String address) {}
