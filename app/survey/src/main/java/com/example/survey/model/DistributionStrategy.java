/*
 * どこで: Survey ドメインモデル
 * 何を: CLOSING リンクの振り分け戦略を表す列挙
 * なぜ: 設定値と DistributionAssigner の分岐を一致させるため
 */
package com.example.survey.model;

public enum DistributionStrategy {
  NONE,
  DAY,
  TIME,
  MIXED,
  RANDOM
}
