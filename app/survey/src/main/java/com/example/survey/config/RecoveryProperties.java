/*
 * どこで: Survey アプリの設定バインド
 * 何を: 起動時復旧の判断方法(対話 or 固定値)を保持する
 * なぜ: 無人運用とテストでは標準入力を待たずに復旧方針を決めるため
 */
package com.example.survey.config;

import com.example.survey.recovery.RecoveryDecisionMode;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "survey.recovery")
@Validated
public record RecoveryProperties(@NotNull RecoveryDecisionMode decision) {}
