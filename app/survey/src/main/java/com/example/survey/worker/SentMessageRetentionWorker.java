/*
 * Where: Survey cleanup worker
 * What: Triggers sent message retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.survey.worker;

import com.example.survey.service.SentMessageRetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "survey.retention.enabled", havingValue = "true")
public class SentMessageRetentionWorker {

  private final SentMessageRetentionService retentionService;

  @Scheduled(fixedDelayString = "${survey.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
