/*
 * どこで: Survey 起動処理
 * 何を: 復旧 → 調査全体のジョブ登録 → 参加締切ジョブ登録 → 受付開始 の順に起動処理を行う
 * なぜ: 復旧が終わる前に参加登録を受け付けて、判断対象の予定が混ざらないようにするため
 */
package com.example.survey.worker;

import com.example.survey.config.StudyProperties;
import com.example.survey.job.SurveyJobScheduler;
import com.example.survey.model.CallbackKind;
import com.example.survey.model.NotificationKind;
import com.example.survey.recovery.RecoveryCoordinator;
import com.example.survey.recovery.RecoveryResult;
import com.example.survey.schedule.StudySchedule;
import com.example.survey.schedule.SurveySchedulePlanner;
import com.example.survey.schedule.TimeGenerator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SurveyStartupRunner implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(SurveyStartupRunner.class);

  private final RecoveryCoordinator recoveryCoordinator;
  private final SurveySchedulePlanner planner;
  private final TimeGenerator timeGenerator;
  private final SurveyJobScheduler jobScheduler;
  private final StudySchedule schedule;
  private final StudyProperties properties;
  private final Clock clock;

  @Override
  public void run(ApplicationArguments args) {
    final RecoveryResult recovery = recoveryCoordinator.recover();
    final int globalJobs = registerGlobalJobs();
    registerEnrollmentClose();
    jobScheduler.openForTraffic();
    logger.info(
        "survey startup completed mode={} recovered={} discardedRows={} globalJobs={}",
        schedule.mode(),
        recovery.registered(),
        recovery.discardedRows(),
        globalJobs);
  }

  int registerGlobalJobs() {
    final Instant now = Instant.now(clock);
    int registered = 0;
    for (NotificationKind kind : List.of(NotificationKind.PERIODIC, NotificationKind.CLOSING)) {
      final List<Instant> timestamps =
          planner.globalPlan(kind).map(timeGenerator::generate).orElse(List.of());
      for (Instant timestamp : timestamps) {
        if (timestamp.isAfter(now)) {
          jobScheduler.register(timestamp, kind);
          registered++;
        }
      }
    }
    return registered;
  }

  private void registerEnrollmentClose() {
    final Instant deadline = schedule.subscriptionDeadlineInstant();
    if (properties.linkDeletion().enrollmentDeleteAtDeadline() && deadline.isAfter(Instant.now(clock))) {
      jobScheduler.registerTask(deadline, CallbackKind.ENROLLMENT_CLOSE);
    }
  }
}
