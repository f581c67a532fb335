package com.example.notifier.service;

import java.util.UUID;

/** Announces that a request changed and needs reconciling. */
public interface NotificationRequestEventPublisher {

  void publishChanged(UUID notificationId, String changeType);
}
