/*
 * どこで: Survey アプリの設定バインド
 * 何を: 群(cohort)ごとの調査リンクと CLOSING リンクの振り分け戦略を保持する
 * なぜ: 群とリンク候補の対応を設定だけで差し替えられるようにするため
 */
package com.example.survey.config;

import com.example.survey.model.DistributionStrategy;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record StudyLinksProperties(
    @NotEmpty List<String> enrollmentUrls,
    @NotEmpty List<String> periodicUrls,
    @NotEmpty List<List<String>> closingUrls,
    @NotNull DistributionStrategy closingDistribution) {

  public int cohortCount() {
    return enrollmentUrls.size();
  }

  // RANDOM 戦略の候補数。群ごとの件数が揃っていることは起動時に検証済み
  public int closingVariantCount() {
    return closingUrls.isEmpty() ? 0 : closingUrls.get(0).size();
  }
}
