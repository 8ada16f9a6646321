/*
 * どこで: Survey スケジュール計算
 * 何を: 調査設定の文字列を解釈し、日付/時刻/リンク数の整合性を検証して StudySchedule を組み立てる
 * なぜ: 不整合な設定でジョブ登録が始まる前に、全ての問題をまとめて起動失敗として報告するため
 */
package com.example.survey.schedule;

import com.example.survey.config.LinkDeletionProperties;
import com.example.survey.config.StudyLinksProperties;
import com.example.survey.config.StudyProperties;
import com.example.survey.config.SurveyKindProperties;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public final class StudyConfigValidator {

  public static final DateTimeFormatter SUBSCRIPTION_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private StudyConfigValidator() {}

  public static StudySchedule validate(StudyProperties properties) {
    final List<String> errors = new ArrayList<>();

    final ZoneId zone = parseZone(properties.zone(), errors);
    final LocalDateTime start =
        parseDateTime("subscription-start", properties.subscriptionStart(), errors);
    final LocalDateTime deadline =
        parseDateTime("subscription-deadline", properties.subscriptionDeadline(), errors);
    final KindSchedule periodic = parseKind("periodic", properties.periodic(), errors);
    final KindSchedule closing = parseKind("closing", properties.closing(), errors);

    if (start != null && deadline != null && start.isAfter(deadline)) {
      errors.add("subscription start date is after subscription deadline");
    }
    validateDatesAndTimes(properties, errors);
    validateLinkDeletion(properties, errors);
    validateUrls(properties, errors);

    if (!errors.isEmpty()) {
      throw new ConfigurationInconsistencyException(errors);
    }
    return new StudySchedule(
        zone,
        start,
        deadline,
        properties.useDayCalculation(),
        properties.useTimeCalculation(),
        properties.useTimeZoneCalculation(),
        periodic,
        closing);
  }

  private static void validateDatesAndTimes(StudyProperties properties, List<String> errors) {
    final SurveyKindProperties periodic = properties.periodic();
    final SurveyKindProperties closing = properties.closing();
    if (!properties.useDayCalculation() && !properties.useTimeCalculation()) {
      compareLengths("periodic.dates", periodic.dates().size(), "periodic.times", periodic.times().size(), errors);
      compareLengths("closing.dates", closing.dates().size(), "closing.times", closing.times().size(), errors);
    }
    if (properties.useDayCalculation() && !properties.useTimeCalculation()) {
      compareLengths(
          "periodic.survey-days", periodic.surveyDays().size(), "periodic.times", periodic.times().size(), errors);
      compareLengths(
          "closing.survey-days", closing.surveyDays().size(), "closing.times", closing.times().size(), errors);
    }
    if (properties.useTimeCalculation()) {
      if (!isPositive(periodic.delayAfterWakeup())) {
        errors.add("'periodic.delay-after-wakeup' must be greater than 0");
      }
      if (periodic.surveysPerDay() <= 0) {
        errors.add("'periodic.surveys-per-day' must be greater than 0");
      }
      if (periodic.surveysPerDay() != 1 && !isPositive(periodic.delayBetweenSurveys())) {
        errors.add("'periodic.delay-between-surveys' must be greater than 0");
      }
      if (!isPositive(closing.delayAfterWakeup())) {
        errors.add("'closing.delay-after-wakeup' must be greater than 0");
      }
      if (closing.surveysPerDay() < 0) {
        errors.add("'closing.surveys-per-day' must be greater or equal than 0");
      }
      if (closing.surveysPerDay() > 1 && !isPositive(closing.delayBetweenSurveys())) {
        errors.add("'closing.delay-between-surveys' must be greater than 0");
      }
    }
    if (periodic.jitter().isNegative()) {
      errors.add("'periodic.jitter' must not be negative");
    }
    if (closing.jitter().isNegative()) {
      errors.add("'closing.jitter' must not be negative");
    }
  }

  private static void validateLinkDeletion(StudyProperties properties, List<String> errors) {
    final LinkDeletionProperties deletion = properties.linkDeletion();
    if (deletion.enrollmentDeleteTimer() && !isPositive(deletion.enrollmentDeleteDelay())) {
      errors.add("'link-deletion.enrollment-delete-delay' must be greater than 0");
    }
    if (deletion.periodicDeleteTimer() && !isPositive(deletion.periodicDeleteDelay())) {
      errors.add("'link-deletion.periodic-delete-delay' must be greater than 0");
    }
    if (deletion.closingDeleteTimer() && !isPositive(deletion.closingDeleteDelay())) {
      errors.add("'link-deletion.closing-delete-delay' must be greater than 0");
    }
    if (properties.closingReminder().enabled() && !isPositive(properties.closingReminder().delay())) {
      errors.add("'closing-reminder.delay' must be greater than 0");
    }
  }

  private static void validateUrls(StudyProperties properties, List<String> errors) {
    final StudyLinksProperties links = properties.links();
    final int enrollment = links.enrollmentUrls().size();
    if (enrollment != links.periodicUrls().size() || enrollment != links.closingUrls().size()) {
      errors.add("Different count of cohorts found in links section.");
    }
    final List<List<String>> closingUrls = links.closingUrls();
    final SurveyKindProperties closing = properties.closing();
    switch (links.closingDistribution()) {
      case TIME -> {
        if (properties.useTimeCalculation()) {
          requireLinkCount(closingUrls, closing.surveysPerDay(), "'closing.surveys-per-day'", errors);
        } else if (!closing.times().isEmpty()) {
          final int first = closing.times().get(0).size();
          if (closing.times().stream().anyMatch(times -> times.size() != first)) {
            errors.add("Different count of times found in 'closing.times'");
          } else {
            requireLinkCount(closingUrls, first, "length of 'closing.times'", errors);
          }
        }
      }
      case DAY -> {
        if (properties.useDayCalculation()) {
          requireLinkCount(closingUrls, closing.surveyDays().size(), "days in 'closing.survey-days'", errors);
        } else {
          requireLinkCount(closingUrls, closing.dates().size(), "days in 'closing.dates'", errors);
        }
      }
      case MIXED -> {
        final int count;
        if (!properties.useTimeCalculation()) {
          count = closing.times().stream().mapToInt(List::size).sum();
        } else if (properties.useDayCalculation()) {
          count = closing.surveysPerDay() * closing.surveyDays().size();
        } else {
          count = closing.surveysPerDay() * closing.dates().size();
        }
        requireLinkCount(closingUrls, count, "the number of closing surveys", errors);
      }
      case NONE -> {
        if (closingUrls.stream().anyMatch(urls -> urls.size() != 1)) {
          errors.add("In distribution mode NONE only one url per cohort is allowed");
        }
      }
      case RANDOM -> {
        if (!closingUrls.isEmpty()) {
          final int first = closingUrls.get(0).size();
          if (first == 0 || closingUrls.stream().anyMatch(urls -> urls.size() != first)) {
            errors.add("In distribution mode RANDOM every cohort should have the same number of links");
          }
        }
      }
    }
  }

  private static void requireLinkCount(
      List<List<String>> closingUrls, int expected, String source, List<String> errors) {
    for (int i = 0; i < closingUrls.size(); i++) {
      if (closingUrls.get(i).size() != expected) {
        errors.add(
            "Different count of links found at position "
                + (i + 1)
                + " in 'links.closing-urls', while "
                + source
                + " is "
                + expected);
      }
    }
  }

  private static void compareLengths(
      String datesName, int dates, String timesName, int times, List<String> errors) {
    if (dates < times) {
      errors.add("Not enough entries in '" + datesName + "' to match number of time lists in '" + timesName + "'.");
    }
    if (times < dates) {
      errors.add("Not enough time lists in '" + timesName + "' to match number of entries in '" + datesName + "'.");
    }
  }

  private static KindSchedule parseKind(String name, SurveyKindProperties kind, List<String> errors) {
    final List<LocalDate> dates = new ArrayList<>();
    for (String date : kind.dates()) {
      try {
        dates.add(LocalDate.parse(date));
      } catch (DateTimeException ex) {
        errors.add("'" + name + ".dates' contains an invalid date: " + date);
      }
    }
    final List<List<LocalTime>> times = new ArrayList<>();
    for (List<String> row : kind.times()) {
      final List<LocalTime> parsed = new ArrayList<>();
      for (String time : row) {
        try {
          parsed.add(LocalTime.parse(time));
        } catch (DateTimeException ex) {
          errors.add("'" + name + ".times' contains an invalid time: " + time);
        }
      }
      times.add(parsed);
    }
    return new KindSchedule(
        dates,
        times,
        kind.surveyDays(),
        kind.jitter(),
        kind.delayAfterWakeup(),
        kind.surveysPerDay(),
        kind.delayBetweenSurveys());
  }

  private static ZoneId parseZone(String zone, List<String> errors) {
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException ex) {
      errors.add("'zone' is not a valid time zone: " + zone);
      return null;
    }
  }

  private static LocalDateTime parseDateTime(String name, String value, List<String> errors) {
    try {
      return LocalDateTime.parse(value, SUBSCRIPTION_FORMAT);
    } catch (DateTimeException ex) {
      errors.add("'" + name + "' must use the format yyyy-MM-dd HH:mm: " + value);
      return null;
    }
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }
}
