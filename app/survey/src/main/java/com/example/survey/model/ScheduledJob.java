/*
 * どこで: Survey ジョブモデル
 * 何を: バックエンドへ登録する 1 件のジョブ
 * なぜ: ハンドラへ渡す (kind, jobId, timestamp) を 1 つにまとめるため
 */
package com.example.survey.model;

import java.time.Instant;

// kind は SURVEY_BROADCAST 以外では null
public record ScheduledJob(
    String jobId, CallbackKind callbackKind, NotificationKind kind, Instant timestamp) {}
