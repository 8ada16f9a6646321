/*
 * どこで: Survey スケジュールモデル
 * 何を: TimeGenerator への入力(モードとそのパラメータ)
 * なぜ: 設定から組み立てた計算条件を副作用なしに受け渡すため
 */
package com.example.survey.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record SchedulePlan(
    TemporalMode mode,
    List<LocalDate> dates,
    DateWindow window,
    List<Integer> dayOffsets,
    List<List<LocalTime>> times,
    WakeupSchedule wakeup) {

  public static SchedulePlan calendar(List<LocalDate> dates, List<List<LocalTime>> times) {
    return new SchedulePlan(TemporalMode.CALENDAR, List.copyOf(dates), null, List.of(), copy(times), null);
  }

  public static SchedulePlan dayOffset(
      DateWindow window, List<Integer> dayOffsets, List<List<LocalTime>> times) {
    return new SchedulePlan(
        TemporalMode.DAY_OFFSET, List.of(), window, List.copyOf(dayOffsets), copy(times), null);
  }

  public static SchedulePlan dayOffset(
      DateWindow window, List<Integer> dayOffsets, WakeupSchedule wakeup) {
    return new SchedulePlan(
        TemporalMode.DAY_OFFSET, List.of(), window, List.copyOf(dayOffsets), List.of(), wakeup);
  }

  public static SchedulePlan wakeup(List<LocalDate> anchorDates, WakeupSchedule wakeup) {
    return new SchedulePlan(TemporalMode.WAKEUP, List.copyOf(anchorDates), null, List.of(), List.of(), wakeup);
  }

  public boolean usesWakeup() {
    return wakeup != null;
  }

  private static List<List<LocalTime>> copy(List<List<LocalTime>> times) {
    return times.stream().map(List::copyOf).toList();
  }
}
