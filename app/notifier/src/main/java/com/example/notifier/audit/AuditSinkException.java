package com.example.notifier.audit;

public class AuditSinkException extends RuntimeException {

  public AuditSinkException(String message, Throwable cause) {
    super(message, cause);
  }
}
