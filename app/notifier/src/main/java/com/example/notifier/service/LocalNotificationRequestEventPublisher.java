/*
 * Where: Notifier service layer
 * What: In-process change publisher that enqueues the reconcile directly
 * Why: Runs without a message broker (local runs and tests)
 */
package com.example.notifier.service;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalNotificationRequestEventPublisher implements NotificationRequestEventPublisher {

  private final ReconcileQueue queue;

  @Override
  public void publishChanged(UUID notificationId, String changeType) {
    queue.enqueue(notificationId);
  }
}
