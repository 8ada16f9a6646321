/*
 * どこで: Survey ジョブ実行基盤
 * 何を: Spring の TaskScheduler 上で job id 単位の予約/取消/発火を管理する
 * なぜ: 同じ job id の二重登録と二重発火を、プロセス内で確実に防ぐため
 */
package com.example.survey.job;

import com.example.common.TraceIds;
import com.example.survey.model.ScheduledJob;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class TaskSchedulerJobBackend implements JobBackend {

  private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerJobBackend.class);

  private final TaskScheduler taskScheduler;
  private final JobDispatcher dispatcher;
  private final Clock clock;
  private final ConcurrentMap<String, LiveJob> liveJobs = new ConcurrentHashMap<>();
  // 発火済み job id と、その job の予定時刻
  private final ConcurrentMap<String, Instant> firedJobs = new ConcurrentHashMap<>();

  public TaskSchedulerJobBackend(TaskScheduler taskScheduler, JobDispatcher dispatcher, Clock clock) {
    this.taskScheduler = taskScheduler;
    this.dispatcher = dispatcher;
    this.clock = clock;
  }

  @Override
  public boolean scheduleAt(ScheduledJob job, Instant fireTime) {
    if (firedJobs.containsKey(job.jobId())) {
      return false;
    }
    final LiveJob entry = new LiveJob(job);
    if (liveJobs.putIfAbsent(job.jobId(), entry) != null) {
      return false;
    }
    // fire は tombstone を置いてから live 表を外すので、ここで見えなければ未発火
    if (firedJobs.containsKey(job.jobId())) {
      liveJobs.remove(job.jobId(), entry);
      return false;
    }
    try {
      entry.future = taskScheduler.schedule(() -> fire(entry), fireTime);
    } catch (TaskRejectedException ex) {
      liveJobs.remove(job.jobId(), entry);
      throw new SchedulingBackendUnavailableException(
          "task scheduler rejected job jobId=" + job.jobId(), ex);
    }
    return true;
  }

  @Override
  public boolean cancel(String jobId) {
    final LiveJob entry = liveJobs.remove(jobId);
    if (entry == null) {
      return false;
    }
    final ScheduledFuture<?> future = entry.future;
    if (future != null) {
      future.cancel(false);
    }
    return true;
  }

  @Override
  public boolean isLive(String jobId) {
    return liveJobs.containsKey(jobId);
  }

  @Override
  public int liveCount() {
    return liveJobs.size();
  }

  @Override
  public boolean hasFired(String jobId) {
    return firedJobs.containsKey(jobId);
  }

  private void fire(LiveJob entry) {
    final ScheduledJob job = entry.job;
    final boolean tombstoned = firedJobs.putIfAbsent(job.jobId(), job.timestamp()) == null;
    // 発火前に live 表から外す。取消と競合した場合は先に外した側が勝つ
    if (!liveJobs.remove(job.jobId(), entry)) {
      if (tombstoned) {
        firedJobs.remove(job.jobId(), job.timestamp());
      }
      return;
    }
    pruneFiredJobs(job.jobId());
    MDC.put("job_id", job.jobId());
    MDC.put("trace_id", TraceIds.forJob(job.jobId()));
    try {
      dispatcher.dispatch(job);
    } catch (RuntimeException ex) {
      logger.error("survey job failed jobId={} callbackKind={}", job.jobId(), job.callbackKind(), ex);
    } finally {
      MDC.remove("job_id");
      MDC.remove("trace_id");
    }
  }

  // 予定時刻を過ぎた job id は登録側が過去の時刻として弾くため、tombstone を残す必要がない
  private void pruneFiredJobs(String firingJobId) {
    final Instant now = Instant.now(clock);
    firedJobs
        .entrySet()
        .removeIf(fired -> !fired.getKey().equals(firingJobId) && fired.getValue().isBefore(now));
  }

  private static final class LiveJob {
    private final ScheduledJob job;
    private volatile ScheduledFuture<?> future;

    private LiveJob(ScheduledJob job) {
      this.job = job;
    }
  }
}
