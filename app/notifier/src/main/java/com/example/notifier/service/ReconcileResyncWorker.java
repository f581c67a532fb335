/*
 * Where: Notifier delivery core
 * What: Periodically enqueues every in-flight request
 * Why: Recovers from lost change events, saturated queues and restarts
 */
package com.example.notifier.service;

import com.example.notifier.config.ReconcileProperties;
import com.example.notifier.repository.NotificationRequestRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notifier.reconcile.enabled", havingValue = "true", matchIfMissing = true)
public class ReconcileResyncWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReconcileResyncWorker.class);

  private final NotificationRequestRepository repository;
  private final ReconcileQueue queue;
  private final ReconcileProperties properties;

  @Scheduled(fixedDelayString = "${notifier.reconcile.resync-interval}")
  public void run() {
    final List<UUID> active = repository.findActiveIds(properties.resyncBatchSize());
    active.forEach(queue::enqueue);
    if (!active.isEmpty()) {
      logger.debug("resync enqueued active requests count={}", active.size());
    }
  }
}
