/*
 * どこで: Survey サービス層
 * 何を: 削除期限を過ぎた送信済みリンクを削除する
 * なぜ: 回答期限後の古いリンクから回答されないようにするため
 */
package com.example.survey.service;

import com.example.survey.job.JobHandler;
import com.example.survey.model.CallbackKind;
import com.example.survey.model.ScheduledJob;
import com.example.survey.model.SentMessage;
import com.example.survey.repository.SentMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LinkExpiryService implements JobHandler {

  private static final Logger logger = LoggerFactory.getLogger(LinkExpiryService.class);

  private final SentMessageRepository sentMessageRepository;
  private final SurveyMessageCleaner messageCleaner;
  private final Clock clock;

  @Override
  public CallbackKind callbackKind() {
    return CallbackKind.LINK_EXPIRY;
  }

  @Override
  public void handle(ScheduledJob job) {
    final List<SentMessage> due = sentMessageRepository.takeDue(Instant.now(clock));
    final int deleted = messageCleaner.deleteAll(due);
    logger.info("survey link expiry jobId={} due={} deleted={}", job.jobId(), due.size(), deleted);
  }
}
