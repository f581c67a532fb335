package com.example.notifier.service;

/** Admission rejected a request that is well-formed JSON but cannot be reconciled. */
public class InvalidNotificationRequestException extends RuntimeException {

  public InvalidNotificationRequestException(String message) {
    super(message);
  }
}
