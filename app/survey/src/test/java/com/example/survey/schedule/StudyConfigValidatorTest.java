/*
 * どこで: Survey 設定検証のユニットテスト
 * 何を: 設定不整合の検出と、全件をまとめた報告を検証する
 * なぜ: 不整合な設定のままジョブ登録が始まらないことを保証するため
 */
package com.example.survey.schedule;

import static com.example.survey.StudyFixtures.calendarKind;
import static com.example.survey.StudyFixtures.calendarStudy;
import static com.example.survey.StudyFixtures.links;
import static com.example.survey.StudyFixtures.noneLinks;
import static com.example.survey.StudyFixtures.study;
import static com.example.survey.StudyFixtures.wakeupKind;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.example.survey.StudyFixtures;
import com.example.survey.config.ClosingReminderProperties;
import com.example.survey.config.LinkDeletionProperties;
import com.example.survey.config.StudyLinksProperties;
import com.example.survey.config.StudyProperties;
import com.example.survey.model.DistributionStrategy;
import com.example.survey.model.TemporalMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;

class StudyConfigValidatorTest {

  @Test
  void validCalendarStudyIsParsed() {
    final StudySchedule schedule = StudyConfigValidator.validate(calendarStudy());

    assertThat(schedule.mode()).isEqualTo(TemporalMode.CALENDAR);
    assertThat(schedule.zone()).isEqualTo(ZoneId.of("UTC"));
    assertThat(schedule.subscriptionStart()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
    assertThat(schedule.periodic().dates())
        .containsExactly(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 2));
    assertThat(schedule.periodic().times().get(1)).containsExactly(LocalTime.of(9, 0), LocalTime.of(18, 0));
    assertThat(schedule.periodic().jitter()).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void startAfterDeadlineIsRejected() {
    final StudyProperties base = calendarStudy();
    final StudyProperties properties =
        new StudyProperties(
            base.zone(),
            "2024-02-01 00:00",
            "2024-01-01 00:00",
            false,
            false,
            false,
            base.periodic(),
            base.closing(),
            base.links(),
            base.linkDeletion(),
            base.closingReminder(),
            base.messages());

    assertThat(errorsOf(properties)).containsExactly("subscription start date is after subscription deadline");
  }

  @Test
  void allProblemsAreReportedTogether() {
    final StudyProperties properties =
        study(
            false,
            false,
            calendarKind(List.of("2024-02-01", "2024-02-02"), List.of(List.of("09:00")), Duration.ZERO),
            calendarKind(List.of("2024-02-03"), List.of(List.of("12:00")), Duration.ZERO),
            links(
                List.of(List.of("a", "b"), List.of("c")),
                DistributionStrategy.NONE));

    final List<String> errors = errorsOf(properties);

    assertThat(errors).hasSize(2);
    assertThat(errors.get(0)).contains("'periodic.times'");
    assertThat(errors.get(1)).contains("NONE");
  }

  @Test
  void wakeupSettingsMustBePositive() {
    final StudyProperties properties =
        study(
            false,
            true,
            wakeupKind(List.of("2024-02-01"), Duration.ZERO, 2, Duration.ZERO),
            wakeupKind(List.of("2024-02-03"), Duration.ofMinutes(30), 1, Duration.ZERO),
            noneLinks());

    assertThat(errorsOf(properties))
        .containsExactly(
            "'periodic.delay-after-wakeup' must be greater than 0",
            "'periodic.delay-between-surveys' must be greater than 0");
  }

  @Test
  void closingSurveysPerDayMayBeZero() {
    final StudyProperties properties =
        study(
            false,
            true,
            wakeupKind(List.of("2024-02-01"), Duration.ofMinutes(30), 1, Duration.ZERO),
            wakeupKind(List.of(), Duration.ofMinutes(30), 0, Duration.ZERO),
            noneLinks());

    assertThat(StudyConfigValidator.validate(properties).mode()).isEqualTo(TemporalMode.WAKEUP);
  }

  @Test
  void enabledTimersNeedPositiveDelays() {
    final StudyProperties properties =
        StudyFixtures.withLinkDeletion(
            calendarStudy(),
            new LinkDeletionProperties(false, true, null, false, true, Duration.ofHours(1), false, true, Duration.ZERO),
            new ClosingReminderProperties(true, null));

    assertThat(errorsOf(properties))
        .containsExactly(
            "'link-deletion.enrollment-delete-delay' must be greater than 0",
            "'link-deletion.closing-delete-delay' must be greater than 0",
            "'closing-reminder.delay' must be greater than 0");
  }

  @Test
  void timeDistributionNeedsOneLinkPerClosingTime() {
    final StudyProperties properties =
        study(
            false,
            false,
            calendarKind(List.of("2024-02-01"), List.of(List.of("09:00")), Duration.ZERO),
            calendarKind(List.of("2024-02-03"), List.of(List.of("12:00", "18:00")), Duration.ZERO),
            links(List.of(List.of("a", "b"), List.of("c")), DistributionStrategy.TIME));

    assertThat(errorsOf(properties))
        .containsExactly(
            "Different count of links found at position 2 in 'links.closing-urls', while length of 'closing.times' is 2");
  }

  @Test
  void cohortCountsMustMatch() {
    final StudyProperties base = calendarStudy();
    final StudyLinksProperties links =
        new StudyLinksProperties(
            List.of("s1", "s2", "s3"), List.of("d1", "d2"), base.links().closingUrls(), DistributionStrategy.NONE);
    final StudyProperties properties =
        study(false, false, base.periodic(), base.closing(), links);

    assertThat(errorsOf(properties)).containsExactly("Different count of cohorts found in links section.");
  }

  @Test
  void unparsableValuesAreReported() {
    final StudyProperties properties =
        study(
            false,
            false,
            calendarKind(List.of("2024-13-01"), List.of(List.of("25:00")), Duration.ZERO),
            calendarKind(List.of("2024-02-03"), List.of(List.of("12:00")), Duration.ZERO),
            noneLinks());

    assertThat(errorsOf(properties))
        .containsExactly(
            "'periodic.dates' contains an invalid date: 2024-13-01",
            "'periodic.times' contains an invalid time: 25:00");
  }

  private static List<String> errorsOf(StudyProperties properties) {
    final ConfigurationInconsistencyException ex =
        catchThrowableOfType(
            () -> StudyConfigValidator.validate(properties), ConfigurationInconsistencyException.class);
    assertThat(ex).isNotNull();
    return ex.errors();
  }
}
