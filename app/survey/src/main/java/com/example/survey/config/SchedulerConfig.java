/*
 * どこで: Survey アプリの設定
 * 何を: 配信ジョブと定期ワーカーが共有する ThreadPoolTaskScheduler を定義する
 * なぜ: 同時刻に発火するジョブを並列に処理し、停止時は実行中のジョブを待ってから終了するため
 */
package com.example.survey.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  @Bean
  public ThreadPoolTaskScheduler surveyTaskScheduler(SurveySchedulerProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.poolSize());
    scheduler.setThreadNamePrefix("survey-job-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds((int) properties.awaitTermination().toSeconds());
    return scheduler;
  }
}
