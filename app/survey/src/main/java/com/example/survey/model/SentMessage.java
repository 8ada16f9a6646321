/*
 * どこで: Survey ドメインモデル
 * 何を: 送信済みリンクメッセージの追跡情報(sent_messages テーブルの 1 行)
 * なぜ: 新しいリンク送信時やタイマー経過後に古いリンクを削除するため
 */
package com.example.survey.model;

import java.time.Instant;

public record SentMessage(
    String recipientId,
    String messageId,
    NotificationKind kind,
    Instant sentAt,
    Instant deleteAfter) {}
