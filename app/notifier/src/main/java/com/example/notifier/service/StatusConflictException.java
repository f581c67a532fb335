package com.example.notifier.service;

import java.util.UUID;

/** Raised when a status write keeps losing the compare-and-set race. */
public class StatusConflictException extends RuntimeException {

  public StatusConflictException(UUID notificationId, String operation, int attempts) {
    super(
        "status update conflict id="
            + notificationId
            + " operation="
            + operation
            + " attempts="
            + attempts);
  }
}
