/*
 * どこで: Survey アプリの設定
 * 何を: 調査設定を検証して StudySchedule と計算コンポーネントを組み立てる
 * なぜ: 設定不整合をジョブ登録より前の Bean 生成時点で起動失敗にするため
 */
package com.example.survey.config;

import com.example.survey.model.RecoveryDecision;
import com.example.survey.recovery.ConsoleRecoveryDecisionProvider;
import com.example.survey.recovery.FixedRecoveryDecisionProvider;
import com.example.survey.recovery.RecoveryDecisionProvider;
import com.example.survey.schedule.DistributionAssigner;
import com.example.survey.schedule.StudyConfigValidator;
import com.example.survey.schedule.StudySchedule;
import com.example.survey.schedule.SurveySchedulePlanner;
import com.example.survey.schedule.TimeGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StudyScheduleConfig {

  @Bean
  public StudySchedule studySchedule(StudyProperties properties) {
    return StudyConfigValidator.validate(properties);
  }

  @Bean
  public TimeGenerator timeGenerator(StudySchedule schedule) {
    return new TimeGenerator(schedule.zone());
  }

  @Bean
  public DistributionAssigner distributionAssigner(StudySchedule schedule) {
    return new DistributionAssigner(schedule.zone());
  }

  @Bean
  public SurveySchedulePlanner surveySchedulePlanner(StudySchedule schedule) {
    return new SurveySchedulePlanner(schedule);
  }

  @Bean
  public RecoveryDecisionProvider recoveryDecisionProvider(RecoveryProperties properties) {
    return switch (properties.decision()) {
      case PROMPT -> new ConsoleRecoveryDecisionProvider(System.in, System.out);
      case RESCHEDULE -> new FixedRecoveryDecisionProvider(RecoveryDecision.RESCHEDULE);
      case DISCARD -> new FixedRecoveryDecisionProvider(RecoveryDecision.DISCARD);
    };
  }
}
