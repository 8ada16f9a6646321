/*
 * どこで: Survey スケジュールモデル
 * 何を: 起床時刻を起点にした 1 日分の送信パターン
 * なぜ: 参加者ごとの起床時刻から当日の送信時刻列を導くため
 */
package com.example.survey.model;

import java.time.Duration;
import java.time.LocalTime;

public record WakeupSchedule(
    LocalTime wakeupTime, Duration delayAfterWakeup, int surveyCount, Duration delayBetween) {}
