/*
 * どこで: Survey ジョブ実行基盤
 * 何を: (時刻, 種別) から決定的な job id を作り、ジッター付きで一度だけ登録する
 * なぜ: 同時刻の配信を参加者全員で 1 ジョブに束ね、再登録や復旧で重複配信しないため
 */
package com.example.survey.job;

import com.example.survey.model.CallbackKind;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.ScheduledJob;
import com.example.survey.schedule.StudySchedule;
import com.example.survey.service.SurveyMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SurveyJobScheduler {

  private static final Logger logger = LoggerFactory.getLogger(SurveyJobScheduler.class);

  private final JobBackend backend;
  private final StudySchedule schedule;
  private final SurveyMetrics metrics;
  private final Clock clock;
  private final DateTimeFormatter jobIdFormat;
  private final AtomicBoolean openForTraffic = new AtomicBoolean(false);

  public SurveyJobScheduler(
      JobBackend backend, StudySchedule schedule, SurveyMetrics metrics, Clock clock) {
    this.backend = backend;
    this.schedule = schedule;
    this.metrics = metrics;
    this.clock = clock;
    this.jobIdFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH:mm").withZone(schedule.zone());
  }

  public String register(Instant timestamp, NotificationKind kind) {
    if (!kind.isSchedulable()) {
      throw new IllegalArgumentException("notification kind cannot be scheduled kind=" + kind);
    }
    final String jobId = jobId(timestamp, kind.name());
    final Instant fireTime = fireTime(timestamp, schedule.forKind(kind).jitter(), Instant.now(clock));
    final ScheduledJob job = new ScheduledJob(jobId, CallbackKind.SURVEY_BROADCAST, kind, timestamp);
    if (backend.scheduleAt(job, fireTime)) {
      logger.info("survey job registered jobId={} fireTime={}", jobId, fireTime);
      metrics.recordJobRegistered(CallbackKind.SURVEY_BROADCAST);
      metrics.updateLiveJobs(backend.liveCount());
    } else {
      logger.debug("survey job already registered or fired jobId={}", jobId);
    }
    return jobId;
  }

  public String registerTask(Instant fireAt, CallbackKind callbackKind) {
    if (callbackKind == CallbackKind.SURVEY_BROADCAST) {
      throw new IllegalArgumentException("survey broadcasts are registered with a notification kind");
    }
    final String jobId = jobId(fireAt, callbackKind.name());
    final Instant now = Instant.now(clock);
    final Instant fireTime = fireAt.isBefore(now) ? now : fireAt;
    if (backend.scheduleAt(new ScheduledJob(jobId, callbackKind, null, fireAt), fireTime)) {
      logger.info("survey task registered jobId={} fireTime={}", jobId, fireTime);
      metrics.recordJobRegistered(callbackKind);
      metrics.updateLiveJobs(backend.liveCount());
    }
    return jobId;
  }

  public void unregister(String jobId) {
    if (backend.cancel(jobId)) {
      logger.info("survey job unregistered jobId={}", jobId);
      metrics.updateLiveJobs(backend.liveCount());
    } else {
      logger.info("survey job already executed or unknown jobId={}", jobId);
    }
  }

  public boolean isLive(String jobId) {
    return backend.isLive(jobId);
  }

  public boolean hasFired(Instant timestamp, NotificationKind kind) {
    return backend.hasFired(jobId(timestamp, kind.name()));
  }

  public int liveJobCount() {
    return backend.liveCount();
  }

  public String jobId(Instant timestamp, String suffix) {
    return jobIdFormat.format(timestamp) + suffix;
  }

  public void openForTraffic() {
    if (openForTraffic.compareAndSet(false, true)) {
      logger.info("survey scheduler open for traffic liveJobs={}", backend.liveCount());
    }
  }

  public boolean isOpenForTraffic() {
    return openForTraffic.get();
  }

  // 後片付け系のタスクは分単位の job id にまとめるため、発火時刻を次の分境界へ切り上げる
  public static Instant ceilToMinute(Instant instant) {
    final Instant truncated = instant.truncatedTo(ChronoUnit.MINUTES);
    return truncated.equals(instant) ? truncated : truncated.plus(1, ChronoUnit.MINUTES);
  }

  // 過去に倒れたジッターは即時発火に丸める
  @VisibleForTesting
  static Instant fireTime(Instant timestamp, Duration jitter, Instant now) {
    Instant fireTime = timestamp;
    final long jitterMillis = jitter.toMillis();
    if (jitterMillis > 0) {
      fireTime =
          timestamp.plusMillis(ThreadLocalRandom.current().nextLong(-jitterMillis, jitterMillis + 1));
    }
    return fireTime.isBefore(now) ? now : fireTime;
  }
}
