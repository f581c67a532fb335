package com.example.notifier.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;

@RequiredArgsConstructor
public class AuditDeadLetterReplayWorker {

  private final AuditDeadLetterReplayService replayService;

  @Scheduled(fixedDelayString = "${notifier.audit.replay-interval}")
  public void run() {
    replayService.replayBatch();
  }
}
