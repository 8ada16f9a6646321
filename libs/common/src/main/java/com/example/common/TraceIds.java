package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // ジョブ実行ごとに job id を接頭辞にして、ログ検索で発火単位を追えるようにする
  public static String forJob(String jobId) {
    return jobId + "/" + newTraceId().substring(0, 8);
  }
}
