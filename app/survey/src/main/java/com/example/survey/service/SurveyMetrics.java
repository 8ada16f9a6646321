/*
 * どこで: Survey サービス層
 * 何を: ジョブ登録数/生存ジョブ数/配信結果/参加結果/復旧件数のメトリクスを記録する
 * なぜ: 配信漏れや復旧時の判断を Prometheus から直接観測できるようにするため
 */
package com.example.survey.service;

import com.example.survey.model.CallbackKind;
import com.example.survey.model.EnrollmentResult;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.RecoveryDecision;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SurveyMetrics {

  private static final String METRIC_JOBS_REGISTERED = "survey.jobs.registered";
  private static final String METRIC_JOBS_LIVE = "survey.jobs.live";
  private static final String METRIC_DELIVERY_TOTAL = "survey.delivery.total";
  private static final String METRIC_ENROLLMENT_TOTAL = "survey.enrollment.total";
  private static final String METRIC_RECOVERY_SLOTS = "survey.recovery.slots";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger liveJobs = new AtomicInteger(0);
  private final ConcurrentMap<Tags, Counter> counters = new ConcurrentHashMap<>();

  public SurveyMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOBS_LIVE, liveJobs, AtomicInteger::get)
        .description("Current number of registered survey jobs waiting to fire")
        .register(meterRegistry);
  }

  public void recordJobRegistered(CallbackKind callbackKind) {
    counter(
            METRIC_JOBS_REGISTERED,
            "Registered survey jobs",
            Tags.of("callback", callbackKind.name().toLowerCase()))
        .increment();
  }

  public void updateLiveJobs(int count) {
    liveJobs.set(Math.max(count, 0));
  }

  public void recordDelivery(NotificationKind kind, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Survey link delivery outcomes",
            Tags.of("kind", kind.name().toLowerCase(), "result", result))
        .increment();
  }

  public void recordEnrollment(EnrollmentResult result) {
    counter(
            METRIC_ENROLLMENT_TOTAL,
            "Enrollment attempts by outcome",
            Tags.of("result", result.name().toLowerCase()))
        .increment();
  }

  public void recordRecovery(RecoveryDecision decision, int slotCount) {
    counter(
            METRIC_RECOVERY_SLOTS,
            "Future job slots handled at startup recovery",
            Tags.of("decision", decision.name().toLowerCase()))
        .increment(slotCount);
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        tags.and("metric", name),
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
