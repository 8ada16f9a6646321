/*
 * どこで: Survey スケジュール計算
 * 何を: 調査設定と参加者情報から種別ごとの SchedulePlan を組み立てる
 * なぜ: 送信モードの分岐をここに集め、TimeGenerator を入力の形だけに依存させるため
 */
package com.example.survey.schedule;

import com.example.survey.model.DateWindow;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.SchedulePlan;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

public class SurveySchedulePlanner {

  private final StudySchedule schedule;

  public SurveySchedulePlanner(StudySchedule schedule) {
    this.schedule = schedule;
  }

  /**
   * 調査全体で共有する送信計画。起床時刻や時差補正で参加者ごとに時刻が変わる設定では空を返す。
   */
  public Optional<SchedulePlan> globalPlan(NotificationKind kind) {
    if (schedule.generatesPerRecipient()) {
      return Optional.empty();
    }
    final KindSchedule kindSchedule = schedule.forKind(kind);
    return switch (schedule.mode()) {
      case CALENDAR -> Optional.of(SchedulePlan.calendar(kindSchedule.dates(), kindSchedule.times()));
      case DAY_OFFSET ->
          Optional.of(
              SchedulePlan.dayOffset(
                  new DateWindow(
                      schedule.subscriptionStart().toLocalDate(),
                      schedule.subscriptionDeadline().toLocalDate()),
                  kindSchedule.surveyDays(),
                  kindSchedule.times()));
      case WAKEUP -> Optional.empty();
    };
  }

  public SchedulePlan recipientPlan(NotificationKind kind, LocalDate today, LocalTime wakeupTime) {
    final KindSchedule kindSchedule = schedule.forKind(kind);
    if (schedule.timeCalculation() && wakeupTime == null) {
      throw new IllegalArgumentException("wakeup time is required when time calculation is enabled");
    }
    return switch (schedule.mode()) {
      case CALENDAR -> SchedulePlan.calendar(kindSchedule.dates(), kindSchedule.times());
      case DAY_OFFSET ->
          schedule.timeCalculation()
              ? SchedulePlan.dayOffset(
                  DateWindow.singleDay(today), kindSchedule.surveyDays(), kindSchedule.wakeupAt(wakeupTime))
              : SchedulePlan.dayOffset(
                  DateWindow.singleDay(today), kindSchedule.surveyDays(), kindSchedule.times());
      case WAKEUP -> SchedulePlan.wakeup(kindSchedule.dates(), kindSchedule.wakeupAt(wakeupTime));
    };
  }
}
