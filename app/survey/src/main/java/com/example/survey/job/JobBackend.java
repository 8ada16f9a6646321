/*
 * どこで: Survey ジョブ実行基盤
 * 何を: job id 単位で発火予約/取消を行うバックエンドの境界
 * なぜ: 登録の冪等性と発火の一意性を実装側に閉じ込め、スケジューラ本体を差し替え可能にするため
 */
package com.example.survey.job;

import com.example.survey.model.ScheduledJob;
import java.time.Instant;

public interface JobBackend {

  /** 同じ job id が予約中または発火済みなら何もせず false を返す。 */
  boolean scheduleAt(ScheduledJob job, Instant fireTime);

  /** 予約中の job を取り消す。見つからなければ false。 */
  boolean cancel(String jobId);

  boolean isLive(String jobId);

  int liveCount();

  /** この job id が既に発火したか。ジッターで予定時刻より前に発火した場合も true。 */
  boolean hasFired(String jobId);
}
