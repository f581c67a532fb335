package com.example.notifier.audit;

import java.util.List;

public interface AuditSink {

  /** Writes a batch or throws {@link AuditSinkException}. */
  void writeBatch(List<AuditEvent> events);
}
