/*
 * どこで: Survey ジョブ実行基盤のユニットテスト
 * 何を: job id の決定性、登録の冪等性、ジッター幅、バックエンド障害時の扱いを検証する
 * なぜ: 同じ (時刻, 種別) の配信が二重に登録・発火されないことを保証するため
 */
package com.example.survey.job;

import static com.example.survey.StudyFixtures.calendarStudy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.survey.model.CallbackKind;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.ScheduledJob;
import com.example.survey.schedule.StudyConfigValidator;
import com.example.survey.service.SurveyMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SurveyJobSchedulerTest {

  private static final Instant FIXED_NOW = Instant.parse("2024-01-10T00:00:00Z");
  private static final Instant SLOT = Instant.parse("2024-02-01T09:00:00Z");

  private InMemoryJobBackend backend;
  private SimpleMeterRegistry registry;
  private SurveyJobScheduler scheduler;

  @BeforeEach
  void setUp() {
    backend = new InMemoryJobBackend();
    registry = new SimpleMeterRegistry();
    scheduler =
        new SurveyJobScheduler(
            backend,
            StudyConfigValidator.validate(calendarStudy()),
            new SurveyMetrics(registry),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void jobIdIsMinuteOfTimestampFollowedByKind() {
    final String jobId = scheduler.register(SLOT, NotificationKind.PERIODIC);

    assertThat(jobId).isEqualTo("2024-02-01-09:00PERIODIC");
    assertThat(scheduler.isLive(jobId)).isTrue();
    final ScheduledJob job = backend.liveJobs().get(jobId);
    assertThat(job.callbackKind()).isEqualTo(CallbackKind.SURVEY_BROADCAST);
    assertThat(job.timestamp()).isEqualTo(SLOT);
  }

  @Test
  void registeringTheSameSlotTwiceKeepsOneJob() {
    final String first = scheduler.register(SLOT, NotificationKind.PERIODIC);
    final String second = scheduler.register(SLOT, NotificationKind.PERIODIC);

    assertThat(second).isEqualTo(first);
    assertThat(scheduler.liveJobCount()).isEqualTo(1);
    assertThat(registry.get("survey.jobs.registered").tag("callback", "survey_broadcast").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void firedJobIsNotRegisteredAgain() {
    final String jobId = scheduler.register(SLOT, NotificationKind.CLOSING);
    backend.fire(jobId);

    scheduler.register(SLOT, NotificationKind.CLOSING);

    assertThat(scheduler.isLive(jobId)).isFalse();
    assertThat(scheduler.hasFired(SLOT, NotificationKind.CLOSING)).isTrue();
    assertThat(scheduler.hasFired(SLOT, NotificationKind.PERIODIC)).isFalse();
  }

  @Test
  void kindsAtTheSameMinuteAreSeparateJobs() {
    scheduler.register(SLOT, NotificationKind.PERIODIC);
    scheduler.register(SLOT, NotificationKind.CLOSING);

    assertThat(scheduler.liveJobCount()).isEqualTo(2);
  }

  @Test
  void enrollmentPromptCannotBeScheduled() {
    assertThatThrownBy(() -> scheduler.register(SLOT, NotificationKind.ENROLLMENT_PROMPT))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unregisteringUnknownJobIsTolerated() {
    assertThatCode(() -> scheduler.unregister("2024-02-01-09:00PERIODIC")).doesNotThrowAnyException();
  }

  @Test
  void unregisterRemovesLiveJob() {
    final String jobId = scheduler.register(SLOT, NotificationKind.PERIODIC);

    scheduler.unregister(jobId);

    assertThat(scheduler.isLive(jobId)).isFalse();
    assertThat(registry.get("survey.jobs.live").gauge().value()).isEqualTo(0.0d);
  }

  @Test
  void backendFailureIsPropagated() {
    backend.setUnavailable(true);

    assertThatThrownBy(() -> scheduler.register(SLOT, NotificationKind.PERIODIC))
        .isInstanceOf(SchedulingBackendUnavailableException.class);
  }

  @Test
  void jitterStaysWithinConfiguredBounds() {
    // PERIODIC のジッター幅は 5 分
    final Duration jitter = Duration.ofMinutes(5);
    for (int i = 0; i < 200; i++) {
      final Instant fireTime = SurveyJobScheduler.fireTime(SLOT, jitter, FIXED_NOW);
      assertThat(fireTime).isBetween(SLOT.minus(jitter), SLOT.plus(jitter));
    }
    scheduler.register(SLOT, NotificationKind.PERIODIC);
    assertThat(backend.fireTime("2024-02-01-09:00PERIODIC")).isBetween(SLOT.minus(jitter), SLOT.plus(jitter));
  }

  @Test
  void pastFireTimeIsClampedToNow() {
    final Instant past = FIXED_NOW.minus(Duration.ofHours(1));

    assertThat(SurveyJobScheduler.fireTime(past, Duration.ZERO, FIXED_NOW)).isEqualTo(FIXED_NOW);
    assertThat(SurveyJobScheduler.fireTime(FIXED_NOW.plusSeconds(30), Duration.ofMinutes(10), FIXED_NOW))
        .isAfterOrEqualTo(FIXED_NOW);
  }

  @Test
  void zeroJitterFiresAtTimestamp() {
    final Instant closing = Instant.parse("2024-02-03T12:00:00Z");

    scheduler.register(closing, NotificationKind.CLOSING);

    assertThat(backend.fireTime("2024-02-03-12:00CLOSING")).isEqualTo(closing);
  }

  @Test
  void tasksUseCallbackKindInJobId() {
    final String jobId = scheduler.registerTask(Instant.parse("2024-01-10T02:00:00Z"), CallbackKind.LINK_EXPIRY);

    assertThat(jobId).isEqualTo("2024-01-10-02:00LINK_EXPIRY");
    assertThat(backend.liveJobs().get(jobId).kind()).isNull();
    assertThatThrownBy(() -> scheduler.registerTask(SLOT, CallbackKind.SURVEY_BROADCAST))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void trafficGateOpensOnce() {
    assertThat(scheduler.isOpenForTraffic()).isFalse();

    scheduler.openForTraffic();
    scheduler.openForTraffic();

    assertThat(scheduler.isOpenForTraffic()).isTrue();
  }

  @Test
  void ceilToMinuteRoundsUpPartialMinutes() {
    assertThat(SurveyJobScheduler.ceilToMinute(Instant.parse("2024-01-10T02:00:00Z")))
        .isEqualTo(Instant.parse("2024-01-10T02:00:00Z"));
    assertThat(SurveyJobScheduler.ceilToMinute(Instant.parse("2024-01-10T02:00:01Z")))
        .isEqualTo(Instant.parse("2024-01-10T02:01:00Z"));
  }
}
