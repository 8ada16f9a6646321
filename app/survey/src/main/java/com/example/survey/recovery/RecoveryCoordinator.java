/*
 * どこで: Survey 起動時復旧
 * 何を: 保存済みの送信予定から未来の (時刻, 種別) を集め、運用者の判断に従って再登録または全削除する
 * なぜ: 再起動でジョブが失われても、重複なく配信を再開できるようにするため
 */
package com.example.survey.recovery;

import com.example.survey.job.SurveyJobScheduler;
import com.example.survey.model.RecoveryDecision;
import com.example.survey.model.ScheduledSlot;
import com.example.survey.repository.OccurrenceRepository;
import com.example.survey.service.SurveyMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecoveryCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(RecoveryCoordinator.class);

  private final OccurrenceRepository occurrenceRepository;
  private final SurveyJobScheduler jobScheduler;
  private final RecoveryDecisionProvider decisionProvider;
  private final SurveyMetrics metrics;
  private final Clock clock;

  public RecoveryResult recover() {
    final Instant now = Instant.now(clock);
    final List<ScheduledSlot> slots = occurrenceRepository.findDistinctSlots();
    final List<ScheduledSlot> pending = new ArrayList<>();
    int past = 0;
    int live = 0;
    for (ScheduledSlot slot : slots) {
      if (!slot.isAfter(now)) {
        // 停止中に過ぎた予定は送らない
        logger.debug("recovery skips past slot timestamp={} kind={}", slot.timestamp(), slot.kind());
        past++;
      } else if (jobScheduler.isLive(jobScheduler.jobId(slot.timestamp(), slot.kind().name()))) {
        live++;
      } else {
        pending.add(slot);
      }
    }
    if (pending.isEmpty()) {
      logger.info("recovery found nothing to reschedule slots={} past={} live={}", slots.size(), past, live);
      return RecoveryResult.nothingToRecover(slots.size(), past, live);
    }

    final RecoveryDecision decision = decisionProvider.decide(pending.size());
    metrics.recordRecovery(decision, pending.size());
    if (decision == RecoveryDecision.DISCARD) {
      final int deleted = occurrenceRepository.deleteAll();
      logger.warn("recovery discarded pending surveys slots={} rows={}", pending.size(), deleted);
      return new RecoveryResult(slots.size(), past, live, 0, deleted, decision);
    }
    pending.forEach(slot -> jobScheduler.register(slot.timestamp(), slot.kind()));
    logger.info("recovery rescheduled pending surveys slots={} past={} live={}", pending.size(), past, live);
    return new RecoveryResult(slots.size(), past, live, pending.size(), 0, decision);
  }
}
