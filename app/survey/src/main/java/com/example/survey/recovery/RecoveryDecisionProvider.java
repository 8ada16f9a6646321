/*
 * どこで: Survey 起動時復旧
 * 何を: 再起動時に残っている未来の送信予定をどう扱うかを決める
 * なぜ: 対話での確認と無人運用での固定値を差し替え可能にするため
 */
package com.example.survey.recovery;

import com.example.survey.model.RecoveryDecision;

public interface RecoveryDecisionProvider {

  RecoveryDecision decide(int futureSlotCount);
}
