/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: スケジュール計算と復旧判定の「現在時刻」をテストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // 保存と比較は UTC の Instant で統一し、暦日の解釈は調査タイムゾーン側で行う
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
