package com.example.survey.service;

// 参加者がボットをブロックした等、送信権限がない場合
public class RecipientUnauthorizedException extends MessengerException {

  private static final long serialVersionUID = 1L;

  public RecipientUnauthorizedException(String recipientId) {
    super("recipient is not reachable recipientId=" + recipientId);
  }
}
