/*
 * Where: Notifier service layer
 * What: Records request phases, delivery attempts, breaker state and audit outcomes
 * Why: Delivery health per channel must be observable from Prometheus
 */
package com.example.notifier.service;

import com.example.notifier.model.NotificationPhase;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring component and cannot be copied defensively")
public class NotifierMetrics {

  static final String METRIC_REQUESTS_TOTAL = "notifier.requests.total";
  static final String METRIC_DELIVERY_ATTEMPTS_TOTAL = "notifier.delivery.attempts.total";
  static final String METRIC_DELIVERY_RETRIES_TOTAL = "notifier.delivery.retries.total";
  static final String METRIC_DELIVERY_DURATION = "notifier.delivery.duration";
  static final String METRIC_CIRCUIT_BREAKER_STATE = "notifier.circuit_breaker.state";
  static final String METRIC_RECONCILE_DURATION = "notifier.reconcile.duration";
  static final String METRIC_AUDIT_EVENTS_TOTAL = "notifier.audit.events.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> deliveryTimers = new ConcurrentHashMap<>();
  private final Timer reconcileTimer;

  public NotifierMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.reconcileTimer =
        Timer.builder(METRIC_RECONCILE_DURATION)
            .description("Wall time of one reconcile invocation")
            .register(meterRegistry);
  }

  public void recordRequestPhase(NotificationPhase phase) {
    counter(METRIC_REQUESTS_TOTAL, "Requests entering a phase", Tags.of("phase", phase.value()))
        .increment();
  }

  /**
   * @param outcome {@code success}, {@code failed}, {@code permanent} or {@code circuit_open}
   */
  public void recordDeliveryAttempt(String channel, String outcome) {
    counter(
            METRIC_DELIVERY_ATTEMPTS_TOTAL,
            "Delivery attempts by channel and outcome",
            Tags.of("channel", channel, "outcome", outcome))
        .increment();
  }

  public void recordRetryScheduled(String channel) {
    counter(METRIC_DELIVERY_RETRIES_TOTAL, "Retries scheduled", Tags.of("channel", channel))
        .increment();
  }

  public void recordDeliveryDuration(String channel, Duration duration) {
    deliveryTimers
        .computeIfAbsent(
            channel,
            ignored ->
                Timer.builder(METRIC_DELIVERY_DURATION)
                    .description("Channel call latency")
                    .tags(Tags.of("channel", channel))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordReconcileDuration(Duration duration) {
    reconcileTimer.record(duration);
  }

  /**
   * @param result {@code buffered}, {@code overflow}, {@code sent}, {@code dead_lettered},
   *     {@code replayed} or {@code lost}
   */
  public void recordAuditEvents(String result, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_AUDIT_EVENTS_TOTAL, "Audit events by result", Tags.of("result", result))
        .increment(count);
  }

  public void registerCircuitBreakerState(String channel, Supplier<Number> state) {
    Gauge.builder(METRIC_CIRCUIT_BREAKER_STATE, state)
        .description("Circuit breaker state: 0 closed, 1 open, 2 half-open")
        .tags(Tags.of("channel", channel))
        .register(meterRegistry);
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
