/*
 * Where: Notifier cleanup worker
 * What: Triggers retention cleanup on a schedule
 */
package com.example.notifier.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notifier.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;

  @Scheduled(fixedDelayString = "${notifier.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
