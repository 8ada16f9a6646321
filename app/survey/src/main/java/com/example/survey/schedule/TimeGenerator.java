/*
 * どこで: Survey スケジュール計算
 * 何を: SchedulePlan から送信時刻の一覧を生成し、参加者ごとの時差補正を最後に適用する
 * なぜ: 3 つの送信モードの時刻展開を時計に依存しない純粋な計算として切り出すため
 */
package com.example.survey.schedule;

import com.example.survey.model.DateWindow;
import com.example.survey.model.RecipientTimeOffset;
import com.example.survey.model.SchedulePlan;
import com.example.survey.model.WakeupSchedule;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

public class TimeGenerator {

  private final ZoneId zone;

  public TimeGenerator(ZoneId zone) {
    this.zone = zone;
  }

  /** 重複を除いた昇順の送信時刻を分単位で返す。時差補正は含まない。 */
  public List<Instant> generate(SchedulePlan plan) {
    final NavigableSet<Instant> result = new TreeSet<>();
    switch (plan.mode()) {
      case CALENDAR -> addCalendar(plan, result);
      case DAY_OFFSET -> addDayOffsets(plan, result);
      case WAKEUP -> {
        for (LocalDate anchor : plan.dates()) {
          addWakeup(anchor, plan.wakeup(), result);
        }
      }
    }
    return List.copyOf(result);
  }

  public List<Instant> generate(SchedulePlan plan, RecipientTimeOffset offset) {
    return shift(generate(plan), offset);
  }

  // job id は分単位なので、補正後も分境界に揃える。要素数と順序は変えない
  public List<Instant> shift(List<Instant> timestamps, RecipientTimeOffset offset) {
    if (offset == null || offset.isZero()) {
      return timestamps;
    }
    return timestamps.stream()
        .map(ts -> ts.plusSeconds(offset.offsetSeconds()).truncatedTo(ChronoUnit.MINUTES))
        .toList();
  }

  public ZoneId zone() {
    return zone;
  }

  private void addCalendar(SchedulePlan plan, NavigableSet<Instant> result) {
    final int count = Math.min(plan.dates().size(), plan.times().size());
    for (int i = 0; i < count; i++) {
      final LocalDate date = plan.dates().get(i);
      for (LocalTime time : plan.times().get(i)) {
        result.add(at(date, time));
      }
    }
  }

  private void addDayOffsets(SchedulePlan plan, NavigableSet<Instant> result) {
    final List<Integer> offsets = plan.dayOffsets();
    for (int i = 0; i < offsets.size(); i++) {
      final DateWindow shifted = plan.window().shiftDays(offsets.get(i));
      for (LocalDate day = shifted.start(); !day.isAfter(shifted.end()); day = day.plusDays(1)) {
        if (plan.usesWakeup()) {
          addWakeup(day, plan.wakeup(), result);
        } else if (i < plan.times().size()) {
          for (LocalTime time : plan.times().get(i)) {
            result.add(at(day, time));
          }
        }
      }
    }
  }

  private void addWakeup(LocalDate anchor, WakeupSchedule wakeup, NavigableSet<Instant> result) {
    LocalDateTime next = LocalDateTime.of(anchor, wakeup.wakeupTime()).plus(wakeup.delayAfterWakeup());
    for (int i = 0; i < wakeup.surveyCount(); i++) {
      if (i > 0) {
        next = next.plus(wakeup.delayBetween());
      }
      result.add(next.atZone(zone).toInstant().truncatedTo(ChronoUnit.MINUTES));
    }
  }

  private Instant at(LocalDate date, LocalTime time) {
    return LocalDateTime.of(date, time).atZone(zone).toInstant().truncatedTo(ChronoUnit.MINUTES);
  }
}
