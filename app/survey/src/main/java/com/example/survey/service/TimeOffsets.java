/*
 * どこで: Survey サービス層
 * 何を: 参加者が申告した現地時刻から、調査タイムゾーンとの時差(秒)を求める
 * なぜ: 申告のずれ(入力までの数分)を 15 分単位に丸めて吸収するため
 */
package com.example.survey.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

public final class TimeOffsets {

  static final long ROUNDING_SECONDS = Duration.ofMinutes(15).toSeconds();

  private TimeOffsets() {}

  // 正の値は参加者の現地時刻が調査タイムゾーンより遅れていることを表す
  public static long offsetSeconds(LocalDateTime reportedLocalTime, Instant now, ZoneId zone) {
    final LocalDateTime studyNow = LocalDateTime.ofInstant(now, zone).truncatedTo(ChronoUnit.MINUTES);
    final long seconds = Duration.between(reportedLocalTime, studyNow).toSeconds();
    return Math.round((double) seconds / ROUNDING_SECONDS) * ROUNDING_SECONDS;
  }
}
