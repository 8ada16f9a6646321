/*
 * どこで: Survey サービス層
 * 何を: チャット基盤への送信/削除の失敗を示す例外
 * なぜ: 1 参加者への失敗を他の参加者への配信から切り離して扱うため
 */
package com.example.survey.service;

public class MessengerException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MessengerException(String message) {
    super(message);
  }

  public MessengerException(String message, Throwable cause) {
    super(message, cause);
  }
}
