/*
 * どこで: Survey ジョブ実行基盤
 * 何を: バックエンドがジョブを受け付けなかったことを表す
 * なぜ: 登録できないまま運用を続けると配信漏れになるため、呼び出し元で致命的エラーとして扱う
 */
package com.example.survey.job;

public class SchedulingBackendUnavailableException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public SchedulingBackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
