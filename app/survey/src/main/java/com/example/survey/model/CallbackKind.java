/*
 * どこで: Survey ジョブモデル
 * 何を: ジョブ発火時に呼ぶ処理の種別を表す閉じた列挙
 * なぜ: バックエンドにはクロージャではなく識別子だけを持たせ、再起動後も同じ処理へ解決できるようにするため
 */
package com.example.survey.model;

public enum CallbackKind {
  SURVEY_BROADCAST,
  CLOSING_REMINDER,
  LINK_EXPIRY,
  ENROLLMENT_CLOSE
}
