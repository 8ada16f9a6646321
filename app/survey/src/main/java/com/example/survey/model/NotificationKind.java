/*
 * どこで: Survey ドメインモデル
 * 何を: 通知の種別を表す列挙
 * なぜ: occurrences テーブルの kind 列と job id の接尾辞を一致させるため
 */
package com.example.survey.model;

public enum NotificationKind {
  ENROLLMENT_PROMPT,
  PERIODIC,
  CLOSING;

  public boolean isSchedulable() {
    return this != ENROLLMENT_PROMPT;
  }
}
