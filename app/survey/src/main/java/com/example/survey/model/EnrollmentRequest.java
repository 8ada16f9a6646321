/*
 * どこで: Survey ドメインモデル
 * 何を: 参加登録の入力
 * なぜ: コマンド層が集めた値(起床時刻・申告時刻・群)をまとめて渡すため
 */
package com.example.survey.model;

import java.time.LocalDateTime;
import java.time.LocalTime;

// cohort / wakeupTime / reportedLocalTime は設定によって不要な場合 null
public record EnrollmentRequest(
    String recipientId, Integer cohort, LocalTime wakeupTime, LocalDateTime reportedLocalTime) {

  public static EnrollmentRequest of(String recipientId) {
    return new EnrollmentRequest(recipientId, null, null, null);
  }
}
