/*
 * どこで: Survey API モデル
 * 何を: デバッグ用送信予定一覧の要素
 * なぜ: 参加者ごとの予定と振り分け結果を確認できるようにするため
 */
package com.example.survey.api;

import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OccurrenceSummary(
    Instant timestamp, NotificationKind kind, int cohort, int distributionIndex, String jobId, boolean jobLive) {

  static OccurrenceSummary of(Occurrence occurrence, String jobId, boolean jobLive) {
    return new OccurrenceSummary(
        occurrence.timestamp(),
        occurrence.kind(),
        occurrence.cohort(),
        occurrence.distributionIndex(),
        jobId,
        jobLive);
  }
}
