package com.example.notifier.service;

import java.util.UUID;

public class NotificationRequestNotFoundException extends RuntimeException {

  public NotificationRequestNotFoundException(UUID notificationId) {
    super("notification request not found: " + notificationId);
  }
}
