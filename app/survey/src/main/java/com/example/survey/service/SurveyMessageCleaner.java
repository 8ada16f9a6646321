/*
 * どこで: Survey サービス層
 * 何を: 送信済みリンクのメッセージをまとめて削除する
 * なぜ: 1 件の削除失敗で残りの削除が止まらないようにするため
 */
package com.example.survey.service;

import com.example.survey.model.SentMessage;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SurveyMessageCleaner {

  private static final Logger logger = LoggerFactory.getLogger(SurveyMessageCleaner.class);

  private final SurveyMessenger messenger;

  public int deleteAll(List<SentMessage> messages) {
    int deleted = 0;
    for (SentMessage message : messages) {
      try {
        messenger.deleteMessage(message.recipientId(), message.messageId());
        deleted++;
      } catch (MessengerException ex) {
        logger.warn(
            "survey message delete failed recipientId={} messageId={} reason={}",
            message.recipientId(),
            message.messageId(),
            ex.getMessage());
      }
    }
    return deleted;
  }
}
