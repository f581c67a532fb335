/*
 * Where: Notifier channels
 * What: One Resilience4j circuit breaker per channel name
 * Why: A failing provider is skipped for a cooldown instead of being hammered by every request
 */
package com.example.notifier.channel;

import com.example.notifier.config.CircuitBreakerProperties;
import com.example.notifier.service.NotifierMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChannelCircuitBreakers {

  private static final Logger logger = LoggerFactory.getLogger(ChannelCircuitBreakers.class);

  private final CircuitBreakerRegistry registry;
  private final NotifierMetrics metrics;

  public ChannelCircuitBreakers(
      CircuitBreakerProperties properties, NotifierMetrics metrics, Clock clock) {
    this.metrics = metrics;
    // A count window of N calls at a 100% threshold opens only after N consecutive failures.
    final CircuitBreakerConfig config =
        CircuitBreakerConfig.custom()
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(properties.failureThreshold())
            .minimumNumberOfCalls(properties.failureThreshold())
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(properties.cooldown())
            .permittedNumberOfCallsInHalfOpenState(1)
            .automaticTransitionFromOpenToHalfOpenEnabled(false)
            .recordExceptions(Throwable.class)
            .clock(clock)
            .build();
    this.registry = CircuitBreakerRegistry.of(config);
    this.registry
        .getEventPublisher()
        .onEntryAdded(event -> register(event.getAddedEntry()));
  }

  /**
   * Returns whether a call to the channel may proceed. A true result takes the single half-open
   * call slot, so every allowed call must be followed by {@link #recordSuccess} or
   * {@link #recordFailure}.
   */
  public boolean allow(String channel) {
    return breaker(channel).tryAcquirePermission();
  }

  public void recordSuccess(String channel, Duration duration) {
    breaker(channel).onSuccess(duration.toNanos(), TimeUnit.NANOSECONDS);
  }

  public void recordFailure(String channel, Duration duration, Throwable error) {
    breaker(channel).onError(duration.toNanos(), TimeUnit.NANOSECONDS, error);
  }

  public CircuitState state(String channel) {
    return toState(breaker(channel));
  }

  private static CircuitState toState(CircuitBreaker breaker) {
    return switch (breaker.getState()) {
      case OPEN, FORCED_OPEN -> CircuitState.OPEN;
      case HALF_OPEN -> CircuitState.HALF_OPEN;
      default -> CircuitState.CLOSED;
    };
  }

  private CircuitBreaker breaker(String channel) {
    return registry.circuitBreaker(channel);
  }

  private void register(CircuitBreaker breaker) {
    final String channel = breaker.getName();
    metrics.registerCircuitBreakerState(channel, () -> toState(breaker).gaugeValue());
    breaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                logger.warn(
                    "circuit breaker transition channel={} transition={}",
                    channel,
                    event.getStateTransition()));
  }
}
