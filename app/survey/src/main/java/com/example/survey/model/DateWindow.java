/*
 * どこで: Survey スケジュールモデル
 * 何を: 両端を含む日付範囲
 * なぜ: 日数オフセット方式で「募集期間 + オフセット」の日付を列挙するため
 */
package com.example.survey.model;

import java.time.LocalDate;

public record DateWindow(LocalDate start, LocalDate end) {

  public static DateWindow singleDay(LocalDate day) {
    return new DateWindow(day, day);
  }

  public DateWindow shiftDays(int days) {
    return new DateWindow(start.plusDays(days), end.plusDays(days));
  }
}
