/*
 * どこで: Survey デバッグ API
 * 何を: チャットのコマンド層の代わりに参加登録/退会/回答確認への返答を受け付ける
 * なぜ: チャット基盤なしで登録からジョブ発火までの流れを確認するため
 */
package com.example.survey.api;

import com.example.survey.model.EnrollmentResult;
import com.example.survey.service.ClosingReminderService;
import com.example.survey.service.EnrollmentService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/survey")
@RequiredArgsConstructor
public class EnrollmentDebugController {

  private final EnrollmentService enrollmentService;
  private final ClosingReminderService closingReminderService;

  @PostMapping("/enrollments")
  public EnrollmentResponse enroll(@Valid @RequestBody EnrollmentRequestBody body) {
    final EnrollmentResult result = enrollmentService.enroll(body.toRequest());
    return new EnrollmentResponse(body.recipientId(), result);
  }

  @DeleteMapping("/enrollments/{recipientId}")
  public Map<String, Object> withdraw(@PathVariable("recipientId") String recipientId) {
    return Map.of("recipient_id", recipientId, "deleted_occurrences", enrollmentService.withdraw(recipientId));
  }

  @PostMapping("/closing-reminders/{recipientId}/reply")
  public Map<String, Object> reply(
      @PathVariable("recipientId") String recipientId, @Valid @RequestBody ClosingReminderReplyBody body) {
    final boolean resent = closingReminderService.handleReply(recipientId, body.surveyAt(), body.completed());
    return Map.of("recipient_id", recipientId, "resent", resent);
  }
}
