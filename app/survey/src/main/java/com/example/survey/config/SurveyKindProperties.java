/*
 * どこで: Survey アプリの設定バインド
 * 何を: PERIODIC / CLOSING それぞれの日付・時刻・日数オフセット・起床時刻設定・ジッター幅を保持する
 * なぜ: 3 つの送信モードの入力を種別単位でまとめるため
 */
package com.example.survey.config;

import java.time.Duration;
import java.util.List;

// dates は "yyyy-MM-dd"、times は "HH:mm" の文字列で受け取り、StudyConfigValidator で解釈する
public record SurveyKindProperties(
    List<String> dates,
    List<List<String>> times,
    List<Integer> surveyDays,
    Duration jitter,
    Duration delayAfterWakeup,
    int surveysPerDay,
    Duration delayBetweenSurveys) {

  public SurveyKindProperties {
    dates = dates == null ? List.of() : List.copyOf(dates);
    times = times == null ? List.of() : times.stream().map(List::copyOf).toList();
    surveyDays = surveyDays == null ? List.of() : List.copyOf(surveyDays);
    jitter = jitter == null ? Duration.ZERO : jitter;
  }
}
