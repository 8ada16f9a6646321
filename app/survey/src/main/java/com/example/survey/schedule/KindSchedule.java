/*
 * どこで: Survey スケジュール計算
 * 何を: 1 種別分の解釈済み送信設定(日付・時刻・日数オフセット・起床時刻設定・ジッター)
 * なぜ: 文字列設定の解釈を起動時の 1 回に限定し、計算側を型付きの値だけで書くため
 */
package com.example.survey.schedule;

import com.example.survey.model.WakeupSchedule;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

public record KindSchedule(
    List<LocalDate> dates,
    List<List<LocalTime>> times,
    List<Integer> surveyDays,
    Duration jitter,
    Duration delayAfterWakeup,
    int surveysPerDay,
    Duration delayBetween) {

  public KindSchedule {
    dates = List.copyOf(dates);
    times = times.stream().map(List::copyOf).toList();
    surveyDays = List.copyOf(surveyDays);
  }

  // 申告された起床時刻の秒以下は捨てる。送信時刻は分単位で束ねるため
  public WakeupSchedule wakeupAt(LocalTime wakeupTime) {
    return new WakeupSchedule(
        wakeupTime == null ? null : wakeupTime.truncatedTo(ChronoUnit.MINUTES),
        delayAfterWakeup,
        surveysPerDay,
        delayBetween);
  }

  public boolean isEmpty() {
    return dates.isEmpty() && surveyDays.isEmpty();
  }
}
