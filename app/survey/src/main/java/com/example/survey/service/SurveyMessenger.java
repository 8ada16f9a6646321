/*
 * どこで: Survey サービス層
 * 何を: 参加者へのリンク送信/リマインダー送信/メッセージ削除の抽象化インターフェース
 * なぜ: チャット基盤への実送信とテスト差し替えを分離するため
 */
package com.example.survey.service;

import com.example.survey.model.NotificationKind;

public interface SurveyMessenger {

  /** 送信したメッセージの id を返す。 */
  String sendLink(String recipientId, NotificationKind kind, String text, String url);

  String sendClosingReminder(String recipientId, String text);

  void deleteMessage(String recipientId, String messageId);
}
