/*
 * どこで: Survey ドメインモデル
 * 何を: 参加者ごとの時計補正値(秒)
 * なぜ: 参加者の申告時刻とサーバ時刻の差を送信時刻へ反映するため
 */
package com.example.survey.model;

public record RecipientTimeOffset(String recipientId, long offsetSeconds) {

  public static RecipientTimeOffset none(String recipientId) {
    return new RecipientTimeOffset(recipientId, 0L);
  }

  public boolean isZero() {
    return offsetSeconds == 0L;
  }
}
