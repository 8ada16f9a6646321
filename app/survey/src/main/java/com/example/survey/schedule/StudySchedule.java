/*
 * どこで: Survey スケジュール計算
 * 何を: 検証済みの調査設定(調査期間・送信モード・種別ごとの送信設定)
 * なぜ: 検証を通過した設定だけがスケジュール計算に渡ることを型で保証するため
 */
package com.example.survey.schedule;

import com.example.survey.model.NotificationKind;
import com.example.survey.model.TemporalMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

public record StudySchedule(
    ZoneId zone,
    LocalDateTime subscriptionStart,
    LocalDateTime subscriptionDeadline,
    boolean dayCalculation,
    boolean timeCalculation,
    boolean timeZoneCalculation,
    KindSchedule periodic,
    KindSchedule closing) {

  public TemporalMode mode() {
    if (dayCalculation) {
      return TemporalMode.DAY_OFFSET;
    }
    return timeCalculation ? TemporalMode.WAKEUP : TemporalMode.CALENDAR;
  }

  // 起床時刻は参加者ごとに異なるため、起床時刻計算を使う場合は参加時に個別生成する
  public boolean generatesPerRecipient() {
    return timeCalculation || timeZoneCalculation;
  }

  public KindSchedule forKind(NotificationKind kind) {
    return switch (kind) {
      case PERIODIC -> periodic;
      case CLOSING -> closing;
      case ENROLLMENT_PROMPT ->
          throw new IllegalArgumentException("enrollment prompt has no schedule");
    };
  }

  public Instant subscriptionStartInstant() {
    return subscriptionStart.atZone(zone).toInstant();
  }

  public Instant subscriptionDeadlineInstant() {
    return subscriptionDeadline.atZone(zone).toInstant();
  }

  public LocalDate today(Instant now) {
    return LocalDate.ofInstant(now, zone);
  }
}
