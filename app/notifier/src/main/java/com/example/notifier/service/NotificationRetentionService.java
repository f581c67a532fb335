/*
 * Where: Notifier service layer
 * What: Applies retention to finished requests and audit dead letters
 * Why: Storage stays bounded while stuck in-flight requests remain visible
 */
package com.example.notifier.service;

import com.example.notifier.config.NotificationRetentionProperties;
import com.example.notifier.repository.AuditDeadLetterRepository;
import com.example.notifier.repository.NotificationRequestRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRequestRepository requestRepository;
  private final AuditDeadLetterRepository auditDeadLetterRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    // In-flight requests are never deleted; old ones point at a stuck reconcile.
    final int staleActiveCount = requestRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "notification retention found stale active requests count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deletedRequests = requestRepository.deleteCompletedBefore(threshold);
    final int deletedDeadLetters = auditDeadLetterRepository.deleteOlderThan(threshold);
    logger.info(
        "notification retention cleanup deleted requests={} auditDeadLetters={} threshold={}",
        deletedRequests,
        deletedDeadLetters,
        threshold);
  }
}
