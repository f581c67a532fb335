/*
 * Where: Notifier audit
 * What: Bounded in-memory buffer flushed to the audit sink by a background thread
 * Why: Delivery latency must not depend on audit sink health; failed batches are dead-lettered
 */
package com.example.notifier.audit;

import com.example.notifier.config.AuditProperties;
import com.example.notifier.repository.AuditDeadLetter;
import com.example.notifier.repository.AuditDeadLetterRepository;
import com.example.notifier.service.NotifierMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BufferedAuditEmitter implements AuditEmitter {

  private static final Logger logger = LoggerFactory.getLogger(BufferedAuditEmitter.class);
  private static final int ERROR_MESSAGE_MAX_LENGTH = 1000;

  private final BlockingQueue<AuditEvent> buffer;
  private final Queue<AuditEvent> overflow = new ConcurrentLinkedQueue<>();
  private final AtomicInteger overflowSize = new AtomicInteger();
  private final AuditSink sink;
  private final AuditDeadLetterRepository deadLetterRepository;
  private final ObjectMapper objectMapper;
  private final AuditProperties properties;
  private final NotifierMetrics metrics;
  private final Clock clock;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private ScheduledExecutorService flusher;

  public BufferedAuditEmitter(
      AuditSink sink,
      AuditDeadLetterRepository deadLetterRepository,
      ObjectMapper objectMapper,
      AuditProperties properties,
      NotifierMetrics metrics,
      Clock clock) {
    this.buffer = new ArrayBlockingQueue<>(properties.bufferCapacity());
    this.sink = sink;
    this.deadLetterRepository = deadLetterRepository;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    flusher =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("audit-flusher-%d").setDaemon(true).build());
    final long intervalMillis = properties.flushInterval().toMillis();
    flusher.scheduleWithFixedDelay(
        this::flushSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    logger.info(
        "audit emitter started bufferCapacity={} batchSize={} flushInterval={}",
        properties.bufferCapacity(),
        properties.batchSize(),
        properties.flushInterval());
  }

  @Override
  public void emit(AuditEvent event) {
    if (event == null) {
      return;
    }
    if (buffer.offer(event)) {
      metrics.recordAuditEvents("buffered", 1);
      return;
    }
    if (overflowSize.incrementAndGet() > properties.overflowCapacity()) {
      overflowSize.decrementAndGet();
      metrics.recordAuditEvents("lost", 1);
      logger.error(
          "audit buffer and overflow full; event lost type={} eventId={} resourceId={}",
          event.eventType(),
          event.eventId(),
          event.resourceId());
      return;
    }
    overflow.add(event);
    metrics.recordAuditEvents("overflow", 1);
  }

  @VisibleForTesting
  int pending() {
    return buffer.size() + overflowSize.get();
  }

  @VisibleForTesting
  int drain() {
    int total = 0;
    int flushed;
    do {
      flushed = flushOnce();
      total += flushed;
    } while (flushed >= properties.batchSize());
    return total;
  }

  /** Sends at most one batch, oldest overflow first. */
  @VisibleForTesting
  int flushOnce() {
    final int batchSize = properties.batchSize();
    final List<AuditEvent> batch = new ArrayList<>(batchSize);
    while (batch.size() < batchSize) {
      final AuditEvent event = overflow.poll();
      if (event == null) {
        break;
      }
      overflowSize.decrementAndGet();
      batch.add(event);
    }
    buffer.drainTo(batch, batchSize - batch.size());
    if (batch.isEmpty()) {
      return 0;
    }
    try {
      sink.writeBatch(batch);
      metrics.recordAuditEvents("sent", batch.size());
    } catch (RuntimeException ex) {
      logger.warn("audit sink write failed; dead-lettering batch size={}", batch.size(), ex);
      deadLetter(batch, ex);
    }
    return batch.size();
  }

  private void flushSafely() {
    try {
      drain();
    } catch (RuntimeException ex) {
      logger.error("audit flush loop failed", ex);
    }
  }

  private void deadLetter(List<AuditEvent> batch, RuntimeException cause) {
    final Instant now = Instant.now(clock);
    final String errorMessage = truncate(String.valueOf(cause.getMessage()));
    final List<AuditDeadLetter> deadLetters = new ArrayList<>(batch.size());
    for (AuditEvent event : batch) {
      try {
        deadLetters.add(
            new AuditDeadLetter(
                UUID.randomUUID(),
                event.eventId(),
                objectMapper.writeValueAsString(event),
                errorMessage,
                1,
                now,
                now));
      } catch (JsonProcessingException ex) {
        metrics.recordAuditEvents("lost", 1);
        logger.error("audit event could not be serialized; lost eventId={}", event.eventId(), ex);
      }
    }
    try {
      deadLetterRepository.insertAll(deadLetters);
      metrics.recordAuditEvents("dead_lettered", deadLetters.size());
    } catch (RuntimeException ex) {
      metrics.recordAuditEvents("lost", deadLetters.size());
      logger.error(
          "audit dead-letter write failed; events lost count={} eventIds={}",
          deadLetters.size(),
          deadLetters.stream().map(AuditDeadLetter::eventId).toList(),
          ex);
    }
  }

  @PreDestroy
  public void stop() {
    // One grace window covers both the running flush and the final drain.
    final Instant deadline = Instant.now(clock).plus(properties.shutdownGrace());
    if (flusher != null) {
      flusher.shutdown();
      try {
        final Duration remaining = Duration.between(Instant.now(clock), deadline);
        if (!flusher.awaitTermination(
            Math.max(0L, remaining.toMillis()), TimeUnit.MILLISECONDS)) {
          flusher.shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        flusher.shutdownNow();
      }
    }
    while (pending() > 0 && Instant.now(clock).isBefore(deadline)) {
      flushOnce();
    }
    final int remaining = pending();
    if (remaining > 0) {
      metrics.recordAuditEvents("lost", remaining);
      logger.error("audit emitter stopped with undelivered events count={}", remaining);
      buffer.clear();
      overflow.clear();
      overflowSize.set(0);
    }
  }

  private String truncate(String message) {
    return message.length() <= ERROR_MESSAGE_MAX_LENGTH
        ? message
        : message.substring(0, ERROR_MESSAGE_MAX_LENGTH);
  }
}
