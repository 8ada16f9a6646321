/*
 * どこで: Survey サービス層
 * 何を: 発火したジョブの (時刻, 種別) に該当する参加者を引き直し、リンクを一斉送信する
 * なぜ: 宛先を発火時に解決し、退会や追加登録をジョブ登録後でも反映するため
 */
package com.example.survey.service;

import com.example.survey.config.ClosingReminderProperties;
import com.example.survey.config.StudyProperties;
import com.example.survey.job.JobHandler;
import com.example.survey.job.SurveyJobScheduler;
import com.example.survey.model.CallbackKind;
import com.example.survey.model.ClosingReminder;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.ScheduledJob;
import com.example.survey.model.SentMessage;
import com.example.survey.repository.ClosingReminderRepository;
import com.example.survey.repository.OccurrenceRepository;
import com.example.survey.repository.SentMessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SurveyBroadcastService implements JobHandler {

  private static final Logger logger = LoggerFactory.getLogger(SurveyBroadcastService.class);

  private final OccurrenceRepository occurrenceRepository;
  private final SentMessageRepository sentMessageRepository;
  private final ClosingReminderRepository reminderRepository;
  private final SurveyJobScheduler jobScheduler;
  private final SurveyMessenger messenger;
  private final SurveyLinkResolver linkResolver;
  private final SurveyMessageCleaner messageCleaner;
  private final StudyProperties properties;
  private final SurveyMetrics metrics;
  private final Clock clock;

  @Override
  public CallbackKind callbackKind() {
    return CallbackKind.SURVEY_BROADCAST;
  }

  @Override
  public void handle(ScheduledJob job) {
    broadcast(job.kind(), job.jobId(), job.timestamp());
  }

  public int broadcast(NotificationKind kind, String jobId, Instant timestamp) {
    jobScheduler.unregister(jobId);

    final List<Occurrence> recipients = occurrenceRepository.findByTimestampAndKind(timestamp, kind);
    if (recipients.isEmpty()) {
      logger.info("survey broadcast has no recipients jobId={}", jobId);
      return 0;
    }
    final Instant now = Instant.now(clock);

    if (properties.linkDeletion().deleteAtNewLink(kind)) {
      final List<SentMessage> previous =
          sentMessageRepository.takeByRecipientsAndKind(
              recipients.stream().map(Occurrence::recipientId).toList(), kind);
      messageCleaner.deleteAll(previous);
    }

    final Instant deleteAfter = properties.linkDeletion().deleteDelay(kind).map(now::plus).orElse(null);
    final ClosingReminderProperties reminder = properties.closingReminder();
    final boolean remind = kind == NotificationKind.CLOSING && reminder.enabled();

    int sent = 0;
    for (Occurrence occurrence : recipients) {
      try {
        final String messageId =
            messenger.sendLink(
                occurrence.recipientId(), kind, linkResolver.text(kind), linkResolver.resolve(occurrence));
        sentMessageRepository.insert(
            new SentMessage(occurrence.recipientId(), messageId, kind, now, deleteAfter));
        if (remind) {
          reminderRepository.insert(
              new ClosingReminder(occurrence.recipientId(), timestamp, now.plus(reminder.delay())));
        }
        metrics.recordDelivery(kind, "sent");
        sent++;
      } catch (RecipientUnauthorizedException ex) {
        metrics.recordDelivery(kind, "unauthorized");
        logger.warn(
            "survey link skipped unauthorized recipientId={} jobId={}", occurrence.recipientId(), jobId);
      } catch (MessengerException ex) {
        metrics.recordDelivery(kind, "failed");
        logger.error(
            "survey link send failed recipientId={} jobId={} reason={}",
            occurrence.recipientId(),
            jobId,
            ex.getMessage());
      } catch (DataAccessException ex) {
        // 送信済みでも追跡行が残らないため、削除タイマーや回答確認の対象から漏れる
        metrics.recordDelivery(kind, "untracked");
        logger.error(
            "survey link tracking failed recipientId={} jobId={}", occurrence.recipientId(), jobId, ex);
      }
    }

    if (sent > 0 && deleteAfter != null) {
      jobScheduler.registerTask(SurveyJobScheduler.ceilToMinute(deleteAfter), CallbackKind.LINK_EXPIRY);
    }
    if (sent > 0 && remind) {
      jobScheduler.registerTask(
          SurveyJobScheduler.ceilToMinute(now.plus(reminder.delay())), CallbackKind.CLOSING_REMINDER);
    }
    logger.info(
        "survey broadcast completed jobId={} recipients={} sent={}", jobId, recipients.size(), sent);
    return sent;
  }
}
