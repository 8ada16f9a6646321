/*
 * どこで: Survey ドメインモデル
 * 何を: 参加者ごとの 1 回分の通知予定(occurrences テーブルの 1 行)
 * なぜ: 登録・配信・復旧で同じ形を共有するため
 */
package com.example.survey.model;

import java.time.Instant;

public record Occurrence(
    String recipientId,
    Instant timestamp,
    NotificationKind kind,
    int cohort,
    int distributionIndex) {

  public static final int NOT_APPLICABLE = -1;

  public OccurrenceKey key() {
    return new OccurrenceKey(recipientId, timestamp, kind);
  }

  public ScheduledSlot slot() {
    return new ScheduledSlot(timestamp, kind);
  }
}
