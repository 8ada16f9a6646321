/*
 * どこで: Survey サービス層
 * 何を: CLOSING 送信後の回答確認を送り、未回答の返答にはリンクを再送する
 * なぜ: 最終調査の回答漏れを減らすため
 */
package com.example.survey.service;

import com.example.survey.job.JobHandler;
import com.example.survey.model.CallbackKind;
import com.example.survey.model.ClosingReminder;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.OccurrenceKey;
import com.example.survey.model.ScheduledJob;
import com.example.survey.model.SentMessage;
import com.example.survey.repository.ClosingReminderRepository;
import com.example.survey.repository.OccurrenceRepository;
import com.example.survey.repository.SentMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ClosingReminderService implements JobHandler {

  private static final Logger logger = LoggerFactory.getLogger(ClosingReminderService.class);

  private final ClosingReminderRepository reminderRepository;
  private final OccurrenceRepository occurrenceRepository;
  private final SentMessageRepository sentMessageRepository;
  private final SurveyMessenger messenger;
  private final SurveyLinkResolver linkResolver;
  private final SurveyMetrics metrics;
  private final Clock clock;

  @Override
  public CallbackKind callbackKind() {
    return CallbackKind.CLOSING_REMINDER;
  }

  @Override
  public void handle(ScheduledJob job) {
    final List<ClosingReminder> due = reminderRepository.takeDue(Instant.now(clock));
    int sent = 0;
    for (ClosingReminder reminder : due) {
      try {
        messenger.sendClosingReminder(reminder.recipientId(), linkResolver.closingReminderText());
        sent++;
      } catch (MessengerException ex) {
        logger.warn(
            "closing reminder send failed recipientId={} reason={}", reminder.recipientId(), ex.getMessage());
      }
    }
    logger.info("closing reminders processed jobId={} due={} sent={}", job.jobId(), due.size(), sent);
  }

  /**
   * 回答確認への返答を処理する。未回答なら同じ CLOSING リンクを再送し、再送できたかどうかを返す。
   */
  public boolean handleReply(String recipientId, Instant surveyAt, boolean completed) {
    if (completed) {
      logger.info("closing survey confirmed recipientId={} surveyAt={}", recipientId, surveyAt);
      return false;
    }
    final Optional<Occurrence> occurrence =
        occurrenceRepository.findOne(new OccurrenceKey(recipientId, surveyAt, NotificationKind.CLOSING));
    if (occurrence.isEmpty()) {
      logger.warn("closing survey not found for reminder reply recipientId={} surveyAt={}", recipientId, surveyAt);
      return false;
    }
    final NotificationKind kind = NotificationKind.CLOSING;
    final String messageId;
    try {
      messageId =
          messenger.sendLink(recipientId, kind, linkResolver.text(kind), linkResolver.resolve(occurrence.get()));
    } catch (MessengerException ex) {
      metrics.recordDelivery(kind, "failed");
      logger.warn(
          "closing survey resend failed recipientId={} surveyAt={} reason={}",
          recipientId,
          surveyAt,
          ex.getMessage());
      return false;
    }
    sentMessageRepository.insert(new SentMessage(recipientId, messageId, kind, Instant.now(clock), null));
    metrics.recordDelivery(kind, "resent");
    return true;
  }
}
