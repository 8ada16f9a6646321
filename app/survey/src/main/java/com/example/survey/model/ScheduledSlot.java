/*
 * どこで: Survey ドメインモデル
 * 何を: 参加者をまたいで共有される (timestamp, kind) の組
 * なぜ: 1 つのジョブ id に対応する単位を復旧処理で扱うため
 */
package com.example.survey.model;

import java.time.Instant;

public record ScheduledSlot(Instant timestamp, NotificationKind kind) {

  public boolean isAfter(Instant now) {
    return timestamp.isAfter(now);
  }
}
