/*
 * Where: Notifier audit emitter tests
 * What: Batching, overflow accounting and dead-lettering of failed batches
 * Why: Audit loss must be counted and logged, never silent
 */
package com.example.notifier.audit;

import static com.example.notifier.audit.AuditTestData.NOW;
import static com.example.notifier.audit.AuditTestData.event;
import static com.example.notifier.audit.AuditTestData.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.notifier.config.AuditProperties;
import com.example.notifier.repository.AuditDeadLetter;
import com.example.notifier.repository.AuditDeadLetterRepository;
import com.example.notifier.service.NotifierMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.util.concurrent.Uninterruptibles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BufferedAuditEmitterTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
  private final List<List<AuditEvent>> sentBatches = new CopyOnWriteArrayList<>();

  @Mock private AuditDeadLetterRepository deadLetterRepository;

  @Test
  void flushSendsAtMostOneBatch() {
    final BufferedAuditEmitter emitter = emitter(properties(10, 10, 2), this::recordBatch);
    emitter.emit(event("console"));
    emitter.emit(event("slack"));
    emitter.emit(event("file"));

    assertThat(emitter.flushOnce()).isEqualTo(2);
    assertThat(emitter.pending()).isEqualTo(1);
    assertThat(emitter.drain()).isEqualTo(1);
    assertThat(sentBatches).hasSize(2);
    assertThat(auditCount("sent")).isEqualTo(3.0d);
    verifyNoInteractions(deadLetterRepository);
  }

  @Test
  void fullBufferSpillsToOverflowThenCountsLoss() {
    final BufferedAuditEmitter emitter = emitter(properties(1, 1, 10), this::recordBatch);

    emitter.emit(event("a"));
    emitter.emit(event("b"));
    emitter.emit(event("c"));

    assertThat(emitter.pending()).isEqualTo(2);
    assertThat(auditCount("buffered")).isEqualTo(1.0d);
    assertThat(auditCount("overflow")).isEqualTo(1.0d);
    assertThat(auditCount("lost")).isEqualTo(1.0d);
    // overflow drains before the buffer
    emitter.flushOnce();
    assertThat(sentBatches.get(0)).hasSize(2);
    assertThat(sentBatches.get(0).get(0).eventData()).containsEntry("channel", "b");
  }

  @Test
  void failedBatchIsDeadLettered() throws Exception {
    final BufferedAuditEmitter emitter =
        emitter(
            properties(10, 10, 10),
            events -> {
              throw new AuditSinkException("audit sink unreachable", null);
            });
    final AuditEvent event = event("slack");
    emitter.emit(event);

    emitter.flushOnce();

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<List<AuditDeadLetter>> captor = ArgumentCaptor.forClass(List.class);
    verify(deadLetterRepository).insertAll(captor.capture());
    final AuditDeadLetter deadLetter = captor.getValue().get(0);
    assertThat(deadLetter.eventId()).isEqualTo(event.eventId());
    assertThat(deadLetter.errorMessage()).isEqualTo("audit sink unreachable");
    assertThat(objectMapper.readValue(deadLetter.eventJson(), AuditEvent.class)).isEqualTo(event);
    assertThat(auditCount("dead_lettered")).isEqualTo(1.0d);
  }

  @Test
  void deadLetterFailureCountsEventsAsLost() {
    doThrow(new IllegalStateException("db down")).when(deadLetterRepository).insertAll(anyList());
    final BufferedAuditEmitter emitter =
        emitter(
            properties(10, 10, 10),
            events -> {
              throw new AuditSinkException("audit sink unreachable", null);
            });
    emitter.emit(event("slack"));
    emitter.emit(event("console"));

    emitter.flushOnce();

    assertThat(auditCount("lost")).isEqualTo(2.0d);
  }

  @Test
  void stopFlushesRemainingEvents() {
    final BufferedAuditEmitter emitter = emitter(properties(10, 10, 10), this::recordBatch);
    emitter.start();
    emitter.emit(event("console"));

    emitter.stop();

    assertThat(emitter.pending()).isZero();
    final List<AuditEvent> all = new ArrayList<>();
    sentBatches.forEach(all::addAll);
    assertThat(all).hasSize(1);
  }

  @Test
  void stopSpendsOneGraceWindowAcrossFlusherAndFinalDrain() throws Exception {
    final CountDownLatch sinkEntered = new CountDownLatch(1);
    final CountDownLatch sinkReleased = new CountDownLatch(1);
    final AuditProperties properties = properties(10, 10, 1);
    final AuditProperties slowShutdown =
        new AuditProperties(
            properties.enabled(),
            properties.baseUrl(),
            properties.path(),
            properties.connectTimeout(),
            properties.readTimeout(),
            properties.bufferCapacity(),
            properties.overflowCapacity(),
            properties.batchSize(),
            properties.flushInterval(),
            Duration.ofSeconds(5),
            properties.replayInterval(),
            properties.replayBatchSize(),
            properties.retentionDays(),
            properties.actorId());
    // Every read moves a full grace window forward, so the window is spent by the second read.
    final Clock steppingClock = new SteppingClock(NOW, slowShutdown.shutdownGrace());
    final BufferedAuditEmitter emitter =
        new BufferedAuditEmitter(
            events -> {
              sinkEntered.countDown();
              Uninterruptibles.awaitUninterruptibly(sinkReleased, 10, TimeUnit.SECONDS);
              recordBatch(events);
            },
            deadLetterRepository,
            objectMapper,
            slowShutdown,
            new NotifierMetrics(registry),
            steppingClock);
    emitter.emit(event("console"));
    emitter.emit(event("slack"));
    emitter.emit(event("file"));
    emitter.start();
    try {
      assertThat(sinkEntered.await(5, TimeUnit.SECONDS)).isTrue();
      final long startedAt = System.nanoTime();

      emitter.stop();

      assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(2));
      assertThat(emitter.pending()).isZero();
      assertThat(auditCount("lost")).isEqualTo(2.0d);
    } finally {
      sinkReleased.countDown();
    }
  }

  private BufferedAuditEmitter emitter(AuditProperties properties, AuditSink sink) {
    return new BufferedAuditEmitter(
        sink,
        deadLetterRepository,
        objectMapper,
        properties,
        new NotifierMetrics(registry),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void recordBatch(List<AuditEvent> events) {
    sentBatches.add(List.copyOf(events));
  }

  private static final class SteppingClock extends Clock {

    private final Duration step;
    private Instant next;

    SteppingClock(Instant start, Duration step) {
      this.next = start;
      this.step = step;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public synchronized Instant instant() {
      final Instant current = next;
      next = next.plus(step);
      return current;
    }
  }

  private double auditCount(String result) {
    return registry.find("notifier.audit.events.total").tag("result", result).counters().stream()
        .mapToDouble(counter -> counter.count())
        .sum();
  }
}
