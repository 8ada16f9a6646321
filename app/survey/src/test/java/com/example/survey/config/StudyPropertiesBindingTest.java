/*
 * どこで: Survey 設定バインドのテスト
 * 何を: 入れ子のリスト(times / closing-urls)と Duration、列挙値のバインドを検証する
 * なぜ: application.yml の書式がレコードへ正しく解釈されることを起動前に保証するため
 */
package com.example.survey.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.survey.model.DistributionStrategy;
import com.example.survey.model.NotificationKind;
import com.example.survey.recovery.RecoveryDecisionMode;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class StudyPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "survey.study.zone=Europe/Berlin",
              "survey.study.subscription-start=2024-01-01 00:00",
              "survey.study.subscription-deadline=2024-01-14 23:59",
              "survey.study.use-day-calculation=true",
              "survey.study.periodic.survey-days[0]=1",
              "survey.study.periodic.survey-days[1]=3",
              "survey.study.periodic.times[0][0]=09:00",
              "survey.study.periodic.times[1][0]=09:00",
              "survey.study.periodic.times[1][1]=18:00",
              "survey.study.periodic.jitter=10m",
              "survey.study.closing.survey-days[0]=5",
              "survey.study.closing.times[0][0]=12:00",
              "survey.study.links.enrollment-urls[0]=https://s.example/start",
              "survey.study.links.periodic-urls[0]=https://s.example/daily",
              "survey.study.links.closing-urls[0][0]=https://s.example/end?v=a",
              "survey.study.links.closing-urls[0][1]=https://s.example/end?v=b",
              "survey.study.links.closing-distribution=RANDOM",
              "survey.study.link-deletion.periodic-delete-timer=true",
              "survey.study.link-deletion.periodic-delete-delay=2h",
              "survey.study.closing-reminder.enabled=true",
              "survey.study.closing-reminder.delay=24h",
              "survey.study.messages.periodic=daily survey",
              "survey.scheduler.pool-size=2",
              "survey.scheduler.await-termination=30s",
              "survey.recovery.decision=DISCARD",
              "survey.retention.enabled=true",
              "survey.retention.retention-days=30",
              "survey.retention.cleanup-interval=1h");

  @Test
  void bindsNestedListsAndDurations() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final StudyProperties study = context.getBean(StudyProperties.class);

          assertThat(study.useDayCalculation()).isTrue();
          assertThat(study.periodic().surveyDays()).containsExactly(1, 3);
          assertThat(study.periodic().times())
              .containsExactly(List.of("09:00"), List.of("09:00", "18:00"));
          assertThat(study.periodic().jitter()).isEqualTo(Duration.ofMinutes(10));
          assertThat(study.periodic().dates()).isEmpty();
          assertThat(study.closing().jitter()).isEqualTo(Duration.ZERO);
          assertThat(study.links().closingDistribution()).isEqualTo(DistributionStrategy.RANDOM);
          assertThat(study.links().closingVariantCount()).isEqualTo(2);
          assertThat(study.links().cohortCount()).isEqualTo(1);
          assertThat(study.linkDeletion().deleteDelay(NotificationKind.PERIODIC))
              .contains(Duration.ofHours(2));
          assertThat(study.linkDeletion().deleteDelay(NotificationKind.CLOSING)).isEmpty();
          assertThat(study.closingReminder().delay()).isEqualTo(Duration.ofHours(24));
          assertThat(study.messages().periodic()).isEqualTo("daily survey");

          assertThat(context.getBean(SurveySchedulerProperties.class).poolSize()).isEqualTo(2);
          assertThat(context.getBean(RecoveryProperties.class).decision())
              .isEqualTo(RecoveryDecisionMode.DISCARD);
          assertThat(context.getBean(SurveyRetentionProperties.class).cleanupInterval())
              .isEqualTo(Duration.ofHours(1));
        });
  }

  @Test
  void missingLinksFailValidation() {
    contextRunner
        .withPropertyValues("survey.study.links.enrollment-urls=")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    StudyProperties.class,
    SurveySchedulerProperties.class,
    RecoveryProperties.class,
    SurveyRetentionProperties.class
  })
  static class TestConfiguration {}
}
