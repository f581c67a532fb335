package com.example.notifier.service;

import com.example.notifier.model.NotificationPhase;
import com.example.notifier.model.NotificationRequest;

/** Outcome of a phase refresh: the phase before it and the request after it. */
public record PhaseTransition(NotificationPhase previous, NotificationRequest request) {

  public NotificationPhase current() {
    return request.status().phase();
  }

  public boolean completedNow() {
    return !previous.isTerminal() && current().isTerminal();
  }
}
