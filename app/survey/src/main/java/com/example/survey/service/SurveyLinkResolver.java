/*
 * どこで: Survey サービス層
 * 何を: 群(cohort)と distribution index から送信するリンクと文面を決める
 * なぜ: 設定のリンク表の引き方を 1 か所にまとめるため
 */
package com.example.survey.service;

import com.example.survey.config.StudyLinksProperties;
import com.example.survey.config.StudyProperties;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SurveyLinkResolver {

  private final StudyProperties properties;

  public String resolve(Occurrence occurrence) {
    return resolve(occurrence.kind(), occurrence.cohort(), occurrence.distributionIndex());
  }

  public String resolve(NotificationKind kind, int cohort, int distributionIndex) {
    final StudyLinksProperties links = properties.links();
    return switch (kind) {
      case ENROLLMENT_PROMPT -> element(links.enrollmentUrls(), cohort, "cohort");
      case PERIODIC -> element(links.periodicUrls(), cohort, "cohort");
      case CLOSING ->
          element(element(links.closingUrls(), cohort, "cohort"), distributionIndex, "distribution index");
    };
  }

  public String text(NotificationKind kind) {
    return switch (kind) {
      case ENROLLMENT_PROMPT -> properties.messages().enrollment();
      case PERIODIC -> properties.messages().periodic();
      case CLOSING -> properties.messages().closing();
    };
  }

  public String closingReminderText() {
    return properties.messages().closingReminder();
  }

  private static <T> T element(List<T> values, int index, String name) {
    if (index < 0 || index >= values.size()) {
      throw new IllegalArgumentException(name + " out of range index=" + index + " size=" + values.size());
    }
    return values.get(index);
  }
}
