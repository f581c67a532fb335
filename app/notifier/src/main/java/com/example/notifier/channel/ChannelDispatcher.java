/*
 * Where: Notifier channels
 * What: Runs a channel delivery on a bounded pool and enforces the per-call timeout
 * Why: A hung provider must cost one retryable attempt, not a stuck reconcile worker
 */
package com.example.notifier.channel;

import com.example.notifier.config.NotificationDeliveryProperties;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChannelDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDispatcher.class);

  private final ExecutorService executor;
  private final Duration timeout;

  public ChannelDispatcher(NotificationDeliveryProperties properties) {
    this.timeout = properties.timeout();
    this.executor =
        Executors.newFixedThreadPool(
            properties.workerThreads(),
            new ThreadFactoryBuilder().setNameFormat("delivery-%d").setDaemon(true).build());
  }

  public DispatchResult dispatch(DeliveryChannel channel, DeliveryPayload payload) {
    final long startedAt = System.nanoTime();
    final Future<?> future;
    try {
      future = executor.submit(() -> channel.deliver(payload));
    } catch (RejectedExecutionException ex) {
      return DispatchResult.failed(
          DeliveryFailure.retryable("delivery executor rejected the call"), ex, elapsed(startedAt));
    }
    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return DispatchResult.success(elapsed(startedAt));
    } catch (TimeoutException ex) {
      future.cancel(true);
      return DispatchResult.failed(
          DeliveryFailure.retryable("delivery timed out after " + timeout.toMillis() + "ms"),
          ex,
          elapsed(startedAt));
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      return DispatchResult.failed(classify(channel, cause), cause, elapsed(startedAt));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return DispatchResult.failed(
          DeliveryFailure.retryable("delivery interrupted"), ex, elapsed(startedAt));
    }
  }

  private DeliveryFailure classify(DeliveryChannel channel, Throwable cause) {
    try {
      return channel.classify(cause);
    } catch (RuntimeException ex) {
      logger.warn("failure classification raised; treating as retryable channel={}", channel.name(), ex);
      return DeliveryFailure.retryable(String.valueOf(cause.getMessage()));
    }
  }

  private Duration elapsed(long startedAt) {
    return Duration.ofNanos(System.nanoTime() - startedAt);
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
