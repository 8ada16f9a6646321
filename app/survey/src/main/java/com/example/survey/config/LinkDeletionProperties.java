/*
 * どこで: Survey アプリの設定バインド
 * 何を: 送信済みリンクの削除タイミング(締切時・新リンク送信時・タイマー)を保持する
 * なぜ: 古いリンクからの回答を防ぐ運用を調査ごとに切り替えるため
 */
package com.example.survey.config;

import com.example.survey.model.NotificationKind;
import java.time.Duration;
import java.util.Optional;

public record LinkDeletionProperties(
    boolean enrollmentDeleteAtDeadline,
    boolean enrollmentDeleteTimer,
    Duration enrollmentDeleteDelay,
    boolean periodicDeleteAtNewLink,
    boolean periodicDeleteTimer,
    Duration periodicDeleteDelay,
    boolean closingDeleteAtNewLink,
    boolean closingDeleteTimer,
    Duration closingDeleteDelay) {

  public boolean deleteAtNewLink(NotificationKind kind) {
    return switch (kind) {
      case PERIODIC -> periodicDeleteAtNewLink;
      case CLOSING -> closingDeleteAtNewLink;
      case ENROLLMENT_PROMPT -> false;
    };
  }

  public Optional<Duration> deleteDelay(NotificationKind kind) {
    return switch (kind) {
      case ENROLLMENT_PROMPT -> enrollmentDeleteTimer ? Optional.ofNullable(enrollmentDeleteDelay) : Optional.empty();
      case PERIODIC -> periodicDeleteTimer ? Optional.ofNullable(periodicDeleteDelay) : Optional.empty();
      case CLOSING -> closingDeleteTimer ? Optional.ofNullable(closingDeleteDelay) : Optional.empty();
    };
  }
}
