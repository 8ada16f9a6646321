/*
 * どこで: Survey アプリの設定バインド
 * 何を: ジョブ実行用スレッドプールの設定を保持する
 * なぜ: 同時刻に集中する配信ジョブの並列度を環境ごとに調整するため
 */
package com.example.survey.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "survey.scheduler")
@Validated
public record SurveySchedulerProperties(@Positive int poolSize, @NotNull Duration awaitTermination) {}
