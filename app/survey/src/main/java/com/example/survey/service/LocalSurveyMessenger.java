/*
 * どこで: Survey サービス層
 * 何を: 送信/削除を模擬する SurveyMessenger 実装
 * なぜ: 外部チャット基盤なしでスケジュールと配信の流れを確認するため
 */
package com.example.survey.service;

import com.example.survey.model.NotificationKind;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalSurveyMessenger implements SurveyMessenger {

  private static final Logger logger = LoggerFactory.getLogger(LocalSurveyMessenger.class);

  @Override
  public String sendLink(String recipientId, NotificationKind kind, String text, String url) {
    final String messageId = UUID.randomUUID().toString();
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "survey link simulated send recipientId={} kind={} messageId={} url={}",
        recipientId,
        kind,
        messageId,
        url);
    return messageId;
  }

  @Override
  public String sendClosingReminder(String recipientId, String text) {
    final String messageId = UUID.randomUUID().toString();
    logger.info("closing reminder simulated send recipientId={} messageId={}", recipientId, messageId);
    return messageId;
  }

  @Override
  public void deleteMessage(String recipientId, String messageId) {
    logger.info("survey message simulated delete recipientId={} messageId={}", recipientId, messageId);
  }
}
