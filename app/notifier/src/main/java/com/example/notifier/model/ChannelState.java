package com.example.notifier.model;

/** Progress of one requested channel, derived from its attempts. */
public enum ChannelState {
  PENDING,
  SUCCEEDED,
  FAILED;

  public boolean isResolved() {
    return this != PENDING;
  }
}
