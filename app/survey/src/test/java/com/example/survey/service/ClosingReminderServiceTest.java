package com.example.survey.service;

import static com.example.survey.StudyFixtures.calendarStudy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.survey.model.CallbackKind;
import com.example.survey.model.ClosingReminder;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.OccurrenceKey;
import com.example.survey.model.ScheduledJob;
import com.example.survey.model.SentMessage;
import com.example.survey.repository.ClosingReminderRepository;
import com.example.survey.repository.OccurrenceRepository;
import com.example.survey.repository.SentMessageRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ClosingReminderServiceTest {

  private static final Instant NOW = Instant.parse("2024-02-03T13:00:00Z");
  private static final Instant SURVEY_AT = Instant.parse("2024-02-03T12:00:00Z");

  @Mock private ClosingReminderRepository reminderRepository;
  @Mock private OccurrenceRepository occurrenceRepository;
  @Mock private SentMessageRepository sentMessageRepository;
  @Mock private SurveyMessenger messenger;

  private SimpleMeterRegistry meterRegistry;
  private ClosingReminderService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new ClosingReminderService(
            reminderRepository,
            occurrenceRepository,
            sentMessageRepository,
            messenger,
            new SurveyLinkResolver(calendarStudy()),
            new SurveyMetrics(meterRegistry),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void dueRemindersAreSentEvenWhenOneFails() {
    when(reminderRepository.takeDue(NOW))
        .thenReturn(
            List.of(new ClosingReminder("r-1", SURVEY_AT, NOW), new ClosingReminder("r-2", SURVEY_AT, NOW)));
    when(messenger.sendClosingReminder("r-1", "did you finish?")).thenThrow(new MessengerException("timeout"));
    when(messenger.sendClosingReminder("r-2", "did you finish?")).thenReturn("c-2");

    service.handle(new ScheduledJob("2024-02-03-13:00CLOSING_REMINDER", CallbackKind.CLOSING_REMINDER, null, NOW));

    verify(messenger).sendClosingReminder("r-2", "did you finish?");
    verify(reminderRepository).takeDue(NOW);
  }

  @Test
  void unfinishedSurveyIsResent() {
    when(occurrenceRepository.findOne(new OccurrenceKey("r-1", SURVEY_AT, NotificationKind.CLOSING)))
        .thenReturn(Optional.of(new Occurrence("r-1", SURVEY_AT, NotificationKind.CLOSING, 0, 0)));
    when(messenger.sendLink("r-1", NotificationKind.CLOSING, "final survey", "https://s.example/end?g=1"))
        .thenReturn("m-9");

    assertThat(service.handleReply("r-1", SURVEY_AT, false)).isTrue();

    verify(sentMessageRepository).insert(new SentMessage("r-1", "m-9", NotificationKind.CLOSING, NOW, null));
  }

  @Test
  void finishedSurveyIsNotResent() {
    assertThat(service.handleReply("r-1", SURVEY_AT, true)).isFalse();

    verifyNoInteractions(messenger, occurrenceRepository);
  }

  @Test
  void replyForUnknownSurveyIsIgnored() {
    when(occurrenceRepository.findOne(any())).thenReturn(Optional.empty());

    assertThat(service.handleReply("r-1", SURVEY_AT, false)).isFalse();

    verifyNoInteractions(messenger, sentMessageRepository);
  }

  @Test
  void failedResendIsReportedAsNotResent() {
    when(occurrenceRepository.findOne(any()))
        .thenReturn(Optional.of(new Occurrence("r-1", SURVEY_AT, NotificationKind.CLOSING, 0, 0)));
    doThrow(new RecipientUnauthorizedException("r-1"))
        .when(messenger)
        .sendLink(anyString(), any(), anyString(), anyString());

    assertThat(service.handleReply("r-1", SURVEY_AT, false)).isFalse();

    verifyNoInteractions(sentMessageRepository);
    assertThat(
            meterRegistry
                .get("survey.delivery.total")
                .tags("kind", "closing", "result", "failed")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
