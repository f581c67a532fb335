package com.example.notifier.audit;

/** Fire-and-forget audit publication; implementations must never block the caller. */
public interface AuditEmitter {

  void emit(AuditEvent event);
}
