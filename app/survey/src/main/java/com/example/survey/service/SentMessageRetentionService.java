/*
 * Where: Survey service layer
 * What: Applies retention policy for tracked link messages without a deletion deadline
 * Why: Prevent unbounded growth of message tracking rows
 */
package com.example.survey.service;

import com.example.survey.config.SurveyRetentionProperties;
import com.example.survey.repository.SentMessageRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SentMessageRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(SentMessageRetentionService.class);

  private final SentMessageRepository sentMessageRepository;
  private final SurveyRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = sentMessageRepository.deleteUntrackedOlderThan(threshold);
    logger.info(
        "sent message retention cleanup deleted messages={} threshold={}", deleted, threshold);
    return deleted;
  }
}
