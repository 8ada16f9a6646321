/*
 * どこで: Survey サービス層
 * 何を: 参加登録時に送信予定を生成・保存し、対応するジョブを登録する。退会時は予定を削除する
 * なぜ: 保存してから登録する順序を守り、発火時に必ず宛先が引けるようにするため
 */
package com.example.survey.service;

import com.example.survey.config.StudyLinksProperties;
import com.example.survey.config.StudyProperties;
import com.example.survey.job.SurveyJobScheduler;
import com.example.survey.model.CallbackKind;
import com.example.survey.model.EnrollmentRequest;
import com.example.survey.model.EnrollmentResult;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.RecipientTimeOffset;
import com.example.survey.model.SchedulePlan;
import com.example.survey.model.ScheduledSlot;
import com.example.survey.model.SentMessage;
import com.example.survey.repository.ClosingReminderRepository;
import com.example.survey.repository.OccurrenceRepository;
import com.example.survey.repository.RecipientTimeOffsetRepository;
import com.example.survey.repository.SentMessageRepository;
import com.example.survey.schedule.DistributionAssigner;
import com.example.survey.schedule.StudySchedule;
import com.example.survey.schedule.SurveySchedulePlanner;
import com.example.survey.schedule.TimeGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class EnrollmentService {

  private static final Logger logger = LoggerFactory.getLogger(EnrollmentService.class);

  private final StudySchedule schedule;
  private final StudyProperties properties;
  private final SurveySchedulePlanner planner;
  private final TimeGenerator timeGenerator;
  private final DistributionAssigner distributionAssigner;
  private final OccurrenceRepository occurrenceRepository;
  private final RecipientTimeOffsetRepository offsetRepository;
  private final ClosingReminderRepository reminderRepository;
  private final SentMessageRepository sentMessageRepository;
  private final SurveyJobScheduler jobScheduler;
  private final SurveyMessenger messenger;
  private final SurveyLinkResolver linkResolver;
  private final SurveyMetrics metrics;
  private final Clock clock;

  public EnrollmentResult enroll(EnrollmentRequest request) {
    if (!jobScheduler.isOpenForTraffic()) {
      throw new IllegalStateException("enrollment is not accepted before startup recovery completes");
    }
    final Instant now = Instant.now(clock);
    final EnrollmentResult rejected = rejection(request.recipientId(), now);
    if (rejected != null) {
      metrics.recordEnrollment(rejected);
      logger.info("enrollment rejected recipientId={} result={}", request.recipientId(), rejected);
      return rejected;
    }

    final RecipientTimeOffset offset = resolveOffset(request, now);
    final int cohort = resolveCohort(request.cohort());
    final LocalDate today = schedule.today(now);

    final List<Occurrence> occurrences = new ArrayList<>();
    occurrences.addAll(
        build(NotificationKind.PERIODIC, request.recipientId(), cohort, today, request.wakeupTime(), offset, now));
    occurrences.addAll(
        build(NotificationKind.CLOSING, request.recipientId(), cohort, today, request.wakeupTime(), offset, now));

    // 行の書き込みが終わってからジョブを登録する。先に発火しても宛先を必ず引けるようにするため
    final int inserted = occurrenceRepository.insertAll(occurrences);
    final Set<ScheduledSlot> slots = new LinkedHashSet<>();
    occurrences.forEach(occurrence -> slots.add(occurrence.slot()));
    slots.forEach(slot -> jobScheduler.register(slot.timestamp(), slot.kind()));

    sendEnrollmentLink(request.recipientId(), cohort, now);
    metrics.recordEnrollment(EnrollmentResult.ENROLLED);
    logger.info(
        "enrollment completed recipientId={} cohort={} occurrences={} slots={} offsetSeconds={}",
        request.recipientId(),
        cohort,
        inserted,
        slots.size(),
        offset.offsetSeconds());
    return EnrollmentResult.ENROLLED;
  }

  @Transactional
  public int withdraw(String recipientId) {
    final int deletedOccurrences = occurrenceRepository.deleteByRecipientId(recipientId);
    final int deletedReminders = reminderRepository.deleteByRecipientId(recipientId);
    final int deletedMessages = sentMessageRepository.deleteByRecipientId(recipientId);
    offsetRepository.delete(recipientId);
    logger.info(
        "recipient withdrawn recipientId={} occurrences={} reminders={} messages={}",
        recipientId,
        deletedOccurrences,
        deletedReminders,
        deletedMessages);
    return deletedOccurrences;
  }

  private EnrollmentResult rejection(String recipientId, Instant now) {
    if (now.isBefore(schedule.subscriptionStartInstant())) {
      return EnrollmentResult.TOO_EARLY;
    }
    if (now.isAfter(schedule.subscriptionDeadlineInstant())) {
      return EnrollmentResult.TOO_LATE;
    }
    if (occurrenceRepository.existsByRecipientId(recipientId)) {
      return EnrollmentResult.ALREADY_ENROLLED;
    }
    return null;
  }

  private List<Occurrence> build(
      NotificationKind kind,
      String recipientId,
      int cohort,
      LocalDate today,
      LocalTime wakeupTime,
      RecipientTimeOffset offset,
      Instant now) {
    final SchedulePlan plan = planner.recipientPlan(kind, today, wakeupTime);
    final List<Instant> timestamps = timeGenerator.generate(plan);
    final List<Integer> indices =
        kind == NotificationKind.CLOSING
            ? distributionAssigner.assign(
                timestamps, properties.links().closingDistribution(), properties.links().closingVariantCount())
            : distributionAssigner.notApplicable(timestamps.size());
    final List<Instant> shifted = timeGenerator.shift(timestamps, offset);

    final List<Occurrence> occurrences = new ArrayList<>(shifted.size());
    for (int i = 0; i < shifted.size(); i++) {
      // 参加時点で過去になった時刻と、ジッターで予定より早く発火済みの時刻は登録しない
      if (shifted.get(i).isAfter(now) && !jobScheduler.hasFired(shifted.get(i), kind)) {
        occurrences.add(new Occurrence(recipientId, shifted.get(i), kind, cohort, indices.get(i)));
      }
    }
    return occurrences;
  }

  private RecipientTimeOffset resolveOffset(EnrollmentRequest request, Instant now) {
    if (!schedule.timeZoneCalculation()) {
      return RecipientTimeOffset.none(request.recipientId());
    }
    if (request.reportedLocalTime() == null) {
      throw new IllegalArgumentException("reported local time is required when time zone calculation is enabled");
    }
    final RecipientTimeOffset offset =
        new RecipientTimeOffset(
            request.recipientId(),
            TimeOffsets.offsetSeconds(request.reportedLocalTime(), now, schedule.zone()));
    offsetRepository.upsert(offset);
    return offset;
  }

  private int resolveCohort(Integer requested) {
    final StudyLinksProperties links = properties.links();
    if (requested == null) {
      return ThreadLocalRandom.current().nextInt(links.cohortCount());
    }
    if (requested < 0 || requested >= links.cohortCount()) {
      throw new IllegalArgumentException(
          "cohort out of range cohort=" + requested + " cohorts=" + links.cohortCount());
    }
    return requested;
  }

  private void sendEnrollmentLink(String recipientId, int cohort, Instant now) {
    final NotificationKind kind = NotificationKind.ENROLLMENT_PROMPT;
    final Optional<Duration> deleteDelay = properties.linkDeletion().deleteDelay(kind);
    final Instant deleteAfter = deleteDelay.map(now::plus).orElse(null);
    try {
      final String messageId =
          messenger.sendLink(
              recipientId, kind, linkResolver.text(kind), linkResolver.resolve(kind, cohort, Occurrence.NOT_APPLICABLE));
      sentMessageRepository.insert(new SentMessage(recipientId, messageId, kind, now, deleteAfter));
      metrics.recordDelivery(kind, "sent");
    } catch (MessengerException ex) {
      metrics.recordDelivery(kind, "failed");
      logger.warn("enrollment link send failed recipientId={} reason={}", recipientId, ex.getMessage());
      return;
    }
    if (deleteAfter != null) {
      jobScheduler.registerTask(SurveyJobScheduler.ceilToMinute(deleteAfter), CallbackKind.LINK_EXPIRY);
    }
  }
}
