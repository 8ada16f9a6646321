/*
 * どこで: Survey スケジュール計算
 * 何を: CLOSING の送信時刻ごとにリンク候補の添字(distribution index)を割り当てる
 * なぜ: 日単位・時刻単位・通し番号・ランダムの振り分けを参加時に 1 回だけ確定させるため
 */
package com.example.survey.schedule;

import com.example.survey.model.DistributionStrategy;
import com.example.survey.model.Occurrence;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public class DistributionAssigner {

  private final ZoneId zone;

  public DistributionAssigner(ZoneId zone) {
    this.zone = zone;
  }

  // 前提: timestamps は昇順。日付の判定は時差補正前の時刻で行う
  public List<Integer> assign(
      List<Instant> timestamps, DistributionStrategy strategy, int variantCount) {
    if (timestamps.isEmpty()) {
      return List.of();
    }
    final List<Integer> indices = new ArrayList<>(timestamps.size());
    LocalDate previousDay = null;
    int dayIndex = -1;
    int timeIndex = 0;
    for (int i = 0; i < timestamps.size(); i++) {
      final LocalDate day = LocalDate.ofInstant(timestamps.get(i), zone);
      final boolean newDay = !day.equals(previousDay);
      if (newDay) {
        dayIndex++;
        timeIndex = 0;
      } else {
        timeIndex++;
      }
      previousDay = day;
      indices.add(
          switch (strategy) {
            case NONE -> 0;
            case DAY -> dayIndex;
            case TIME -> timeIndex;
            case MIXED -> i;
            case RANDOM -> randomIndex(variantCount);
          });
    }
    return Collections.unmodifiableList(indices);
  }

  public List<Integer> notApplicable(int size) {
    return Collections.nCopies(size, Occurrence.NOT_APPLICABLE);
  }

  private static int randomIndex(int variantCount) {
    if (variantCount <= 0) {
      throw new IllegalArgumentException("variantCount must be positive for RANDOM distribution");
    }
    return ThreadLocalRandom.current().nextInt(variantCount);
  }
}
