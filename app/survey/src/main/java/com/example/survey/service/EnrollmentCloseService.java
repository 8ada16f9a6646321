/*
 * どこで: Survey サービス層
 * 何を: 参加締切時刻に参加用リンクをまとめて削除する
 * なぜ: 締切後に参加用リンクから登録されないようにするため
 */
package com.example.survey.service;

import com.example.survey.job.JobHandler;
import com.example.survey.model.CallbackKind;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.ScheduledJob;
import com.example.survey.model.SentMessage;
import com.example.survey.repository.SentMessageRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EnrollmentCloseService implements JobHandler {

  private static final Logger logger = LoggerFactory.getLogger(EnrollmentCloseService.class);

  private final SentMessageRepository sentMessageRepository;
  private final SurveyMessageCleaner messageCleaner;

  @Override
  public CallbackKind callbackKind() {
    return CallbackKind.ENROLLMENT_CLOSE;
  }

  @Override
  public void handle(ScheduledJob job) {
    final List<SentMessage> prompts = sentMessageRepository.takeByKind(NotificationKind.ENROLLMENT_PROMPT);
    final int deleted = messageCleaner.deleteAll(prompts);
    logger.info("enrollment links removed at deadline jobId={} deleted={}", job.jobId(), deleted);
  }
}
