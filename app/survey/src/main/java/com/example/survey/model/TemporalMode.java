/*
 * どこで: Survey ドメインモデル
 * 何を: 送信時刻の算出モードを表す列挙
 * なぜ: 設定フラグの組み合わせを排他的なモードへ正規化するため
 */
package com.example.survey.model;

public enum TemporalMode {
  CALENDAR,
  DAY_OFFSET,
  WAKEUP
}
