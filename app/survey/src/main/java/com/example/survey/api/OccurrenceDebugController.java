/*
 * どこで: Survey デバッグ API
 * 何を: 参加者ごとの送信予定の一覧/削除と、ジョブの登録状態の確認を行う
 * なぜ: 動作確認と運用時の調査のため
 */
package com.example.survey.api;

import com.example.survey.job.SurveyJobScheduler;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.OccurrenceKey;
import com.example.survey.repository.OccurrenceRepository;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/survey")
@RequiredArgsConstructor
public class OccurrenceDebugController {

  private final OccurrenceRepository occurrenceRepository;
  private final SurveyJobScheduler jobScheduler;

  @GetMapping("/occurrences/{recipientId}")
  public OccurrenceListResponse occurrences(@PathVariable("recipientId") String recipientId) {
    final List<OccurrenceSummary> items =
        occurrenceRepository.findByRecipientId(recipientId).stream().map(this::toSummary).toList();
    return new OccurrenceListResponse(recipientId, items);
  }

  // 共有ジョブは他の参加者の予定も含むため、行だけを消してジョブは残す
  @DeleteMapping("/occurrences/{recipientId}")
  public ResponseEntity<Void> delete(
      @PathVariable("recipientId") String recipientId,
      @RequestParam("timestamp") Instant timestamp,
      @RequestParam("kind") NotificationKind kind) {
    if (!occurrenceRepository.delete(new OccurrenceKey(recipientId, timestamp, kind))) {
      throw new OccurrenceNotFoundException(
          "occurrence not found recipientId=" + recipientId + " timestamp=" + timestamp + " kind=" + kind);
    }
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/jobs/{jobId}")
  public JobStatusResponse job(@PathVariable("jobId") String jobId) {
    return new JobStatusResponse(jobId, jobScheduler.isLive(jobId), jobScheduler.liveJobCount());
  }

  private OccurrenceSummary toSummary(Occurrence occurrence) {
    final String jobId = jobScheduler.jobId(occurrence.timestamp(), occurrence.kind().name());
    return OccurrenceSummary.of(occurrence, jobId, jobScheduler.isLive(jobId));
  }
}
