/*
 * Where: Notifier channels
 * What: Posts the notification to an HTTP endpoint such as a Slack incoming webhook
 * Why: Provider status codes decide between retrying later and giving up
 */
package com.example.notifier.channel;

import com.example.common.CorrelationIds;
import com.example.notifier.model.Priority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class WebhookDeliveryChannel implements DeliveryChannel {

  private static final int TOO_MANY_REQUESTS = 429;
  private static final int REQUEST_TIMEOUT = 408;
  private static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";
  // Reset values below this are relative seconds rather than epoch seconds.
  private static final long EPOCH_SECONDS_THRESHOLD = 1_000_000_000L;

  private final String name;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring component and cannot be copied defensively")
  private final RestClient restClient;

  private final String url;
  private final Map<String, String> headers;
  private final Clock clock;

  public WebhookDeliveryChannel(
      String name, RestClient restClient, String url, Map<String, String> headers, Clock clock) {
    this.name = name;
    this.restClient = restClient;
    this.url = url;
    this.headers = headers == null ? Map.of() : Map.copyOf(headers);
    this.clock = clock;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean requiresRecipients() {
    return true;
  }

  @Override
  public void deliver(DeliveryPayload payload) {
    try {
      restClient
          .post()
          .uri(url)
          .contentType(MediaType.APPLICATION_JSON)
          .headers(
              httpHeaders -> {
                headers.forEach(httpHeaders::set);
                if (payload.correlationId() != null) {
                  httpHeaders.set(CorrelationIds.HEADER, payload.correlationId());
                }
              })
          .body(WebhookMessage.from(payload))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw new DeliveryException(classifyResponse(ex), ex);
    } catch (ResourceAccessException ex) {
      final String reason =
          isTimeout(ex) ? name + " request timed out" : name + " connection failed";
      throw new DeliveryException(DeliveryFailure.retryable(reason), ex);
    }
  }

  @Override
  public DeliveryFailure classify(Throwable error) {
    if (error instanceof IllegalArgumentException) {
      return DeliveryFailure.permanent(name + " endpoint is invalid: " + error.getMessage());
    }
    return DeliveryChannel.super.classify(error);
  }

  private DeliveryFailure classifyResponse(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    final String reason = name + " responded with http status " + status;
    if (status == TOO_MANY_REQUESTS) {
      return DeliveryFailure.retryable(reason, retryAfter(ex.getResponseHeaders()));
    }
    if (status == REQUEST_TIMEOUT || ex.getStatusCode().is5xxServerError()) {
      return DeliveryFailure.retryable(reason, retryAfter(ex.getResponseHeaders()));
    }
    // Remaining 4xx (auth, bad payload, unknown channel) will not heal on retry.
    return DeliveryFailure.permanent(reason);
  }

  private Duration retryAfter(HttpHeaders responseHeaders) {
    if (responseHeaders == null) {
      return null;
    }
    final String value = responseHeaders.getFirst(HttpHeaders.RETRY_AFTER);
    if (value == null || value.isBlank()) {
      return rateLimitReset(responseHeaders.getFirst(RATE_LIMIT_RESET));
    }
    final String trimmed = value.trim();
    try {
      final long seconds = Long.parseLong(trimmed);
      return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException notSeconds) {
      try {
        final Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        final Duration until = Duration.between(Instant.now(clock), at);
        return until.isNegative() || until.isZero() ? null : until;
      } catch (DateTimeParseException unparseable) {
        return null;
      }
    }
  }

  private Duration rateLimitReset(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    final long reset;
    try {
      reset = Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
    final Duration until =
        reset < EPOCH_SECONDS_THRESHOLD
            ? Duration.ofSeconds(reset)
            : Duration.between(Instant.now(clock), Instant.ofEpochSecond(reset));
    return until.isNegative() || until.isZero() ? null : until;
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record WebhookMessage(
      String text,
      UUID notificationId,
      String subject,
      String body,
      Priority priority,
      List<String> recipients,
      String correlationId) {

    static WebhookMessage from(DeliveryPayload payload) {
      final String text =
          payload.subject() == null || payload.subject().isBlank()
              ? payload.body()
              : "*" + payload.subject() + "*\n" + payload.body();
      return new WebhookMessage(
          text,
          payload.notificationId(),
          payload.subject(),
          payload.body(),
          payload.priority(),
          payload.recipients(),
          payload.correlationId());
    }
  }
}
