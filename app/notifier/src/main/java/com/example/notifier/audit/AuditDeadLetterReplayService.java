/*
 * Where: Notifier audit
 * What: Re-sends dead-lettered audit events to the audit sink
 * Why: Events written during a sink outage must still reach the audit store
 */
package com.example.notifier.audit;

import com.example.notifier.config.AuditProperties;
import com.example.notifier.repository.AuditDeadLetter;
import com.example.notifier.repository.AuditDeadLetterRepository;
import com.example.notifier.service.NotifierMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@RequiredArgsConstructor
public class AuditDeadLetterReplayService {

  private static final Logger logger = LoggerFactory.getLogger(AuditDeadLetterReplayService.class);

  private final AuditDeadLetterRepository deadLetterRepository;
  private final AuditSink sink;
  private final ObjectMapper objectMapper;
  private final AuditProperties properties;
  private final NotifierMetrics metrics;
  private final Clock clock;

  /** Replays the oldest batch; returns how many events reached the sink. */
  public int replayBatch() {
    final List<AuditDeadLetter> deadLetters =
        deadLetterRepository.findOldest(properties.replayBatchSize());
    if (deadLetters.isEmpty()) {
      return 0;
    }
    final List<AuditEvent> events = new ArrayList<>(deadLetters.size());
    final List<UUID> replayable = new ArrayList<>(deadLetters.size());
    final List<UUID> corrupt = new ArrayList<>();
    for (AuditDeadLetter deadLetter : deadLetters) {
      try {
        events.add(objectMapper.readValue(deadLetter.eventJson(), AuditEvent.class));
        replayable.add(deadLetter.id());
      } catch (JsonProcessingException ex) {
        logger.error(
            "audit dead letter is unreadable; discarding id={} eventId={}",
            deadLetter.id(),
            deadLetter.eventId(),
            ex);
        corrupt.add(deadLetter.id());
      }
    }
    if (!corrupt.isEmpty()) {
      deadLetterRepository.deleteByIds(corrupt);
      metrics.recordAuditEvents("lost", corrupt.size());
    }
    if (events.isEmpty()) {
      return 0;
    }
    try {
      sink.writeBatch(events);
    } catch (RuntimeException ex) {
      deadLetterRepository.markAttempted(
          replayable, String.valueOf(ex.getMessage()), Instant.now(clock));
      logger.warn("audit dead letter replay failed count={}", events.size(), ex);
      return 0;
    }
    deadLetterRepository.deleteByIds(replayable);
    metrics.recordAuditEvents("replayed", events.size());
    logger.info("audit dead letters replayed count={}", events.size());
    return events.size();
  }
}
