/*
 * どこで: Survey API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 受付開始(復旧完了)かどうかを手早く確認するため
 */
package com.example.survey.api;

import com.example.survey.job.SurveyJobScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final SurveyJobScheduler jobScheduler;

  @GetMapping("/")
  public String home() {
    return jobScheduler.isOpenForTraffic() ? "survey: ok" : "survey: starting";
  }
}
