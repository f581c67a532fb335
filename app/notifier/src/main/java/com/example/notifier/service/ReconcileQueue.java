/*
 * Where: Notifier delivery core
 * What: Bounded worker pool that runs reconciles, with delayed requeue
 * Why: Change events, resync and retry timers all funnel here; duplicates of a queued id collapse
 */
package com.example.notifier.service;

import com.example.notifier.config.ReconcileProperties;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ReconcileQueue {

  private static final Logger logger = LoggerFactory.getLogger(ReconcileQueue.class);

  private final NotificationReconciler reconciler;
  private final ReconcileProperties properties;
  private final ThreadPoolExecutor workers;
  private final ScheduledExecutorService timers;
  private final Set<UUID> queued = ConcurrentHashMap.newKeySet();

  public ReconcileQueue(NotificationReconciler reconciler, ReconcileProperties properties) {
    this.reconciler = reconciler;
    this.properties = properties;
    this.workers =
        new ThreadPoolExecutor(
            properties.workerThreads(),
            properties.workerThreads(),
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(properties.queueCapacity()),
            new ThreadFactoryBuilder().setNameFormat("reconcile-%d").setDaemon(true).build());
    this.timers =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("reconcile-timer-%d").setDaemon(true).build());
  }

  /** Queues a reconcile unless one for the same id is already waiting. */
  public void enqueue(UUID notificationId) {
    if (!queued.add(notificationId)) {
      return;
    }
    try {
      workers.execute(() -> run(notificationId));
    } catch (RejectedExecutionException ex) {
      queued.remove(notificationId);
      // Resync picks it up later.
      logger.warn("reconcile queue saturated; deferring to resync id={}", notificationId);
    }
  }

  public void enqueueAfter(UUID notificationId, Duration delay) {
    if (delay == null || delay.isZero() || delay.isNegative()) {
      enqueue(notificationId);
      return;
    }
    try {
      timers.schedule(() -> enqueue(notificationId), delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      logger.warn("reconcile timer rejected requeue; deferring to resync id={}", notificationId);
    }
  }

  @VisibleForTesting
  int queuedCount() {
    return queued.size();
  }

  @VisibleForTesting
  void run(UUID notificationId) {
    queued.remove(notificationId);
    try {
      final ReconcileResult result = reconciler.reconcile(notificationId);
      if (result.requeue()) {
        enqueueAfter(notificationId, result.requeueAfter());
      }
    } catch (StatusConflictException ex) {
      logger.warn("reconcile gave up on status conflicts; requeueing id={}", notificationId, ex);
      enqueueAfter(notificationId, properties.errorRequeueDelay());
    } catch (RuntimeException ex) {
      logger.error("reconcile failed; requeueing id={}", notificationId, ex);
      enqueueAfter(notificationId, properties.errorRequeueDelay());
    }
  }

  @PreDestroy
  public void shutdown() {
    timers.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(properties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("reconcile workers still busy after grace period; interrupting");
        workers.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }
}
