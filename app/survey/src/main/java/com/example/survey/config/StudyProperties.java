/*
 * どこで: Survey アプリの設定バインド
 * 何を: 調査期間・送信モード・種別ごとの送信設定・リンク設定を保持する
 * なぜ: 調査ごとの差分を application.yml に閉じ込め、起動時にまとめて検証するため
 */
package com.example.survey.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "survey.study")
@Validated
public record StudyProperties(
    @NotBlank String zone,
    @NotBlank String subscriptionStart,
    @NotBlank String subscriptionDeadline,
    boolean useDayCalculation,
    boolean useTimeCalculation,
    boolean useTimeZoneCalculation,
    @NotNull @Valid SurveyKindProperties periodic,
    @NotNull @Valid SurveyKindProperties closing,
    @NotNull @Valid StudyLinksProperties links,
    @NotNull LinkDeletionProperties linkDeletion,
    @NotNull ClosingReminderProperties closingReminder,
    @NotNull StudyMessagesProperties messages) {}
