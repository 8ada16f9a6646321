/*
 * どこで: Survey スケジュール計算
 * 何を: 調査設定の不整合を全件まとめて通知する
 * なぜ: 起動時に 1 回で全ての修正点を運用者へ示すため
 */
package com.example.survey.schedule;

import java.util.List;

public class ConfigurationInconsistencyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final List<String> errors;

  public ConfigurationInconsistencyException(List<String> errors) {
    super("study configuration is inconsistent: " + String.join("; ", errors));
    this.errors = List.copyOf(errors);
  }

  public List<String> errors() {
    return errors;
  }
}
