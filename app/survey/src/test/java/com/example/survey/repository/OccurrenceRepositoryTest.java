/*
 * どこで: Survey リポジトリの統合テスト
 * 何を: 送信予定の冪等挿入、スロット単位の引き直し、復旧用の集約クエリを Postgres で検証する
 * なぜ: 発火時の宛先解決と起動時復旧が DB の内容だけに依存するため
 */
package com.example.survey.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.survey.AbstractPostgresContainerTest;
import com.example.survey.model.NotificationKind;
import com.example.survey.model.Occurrence;
import com.example.survey.model.OccurrenceKey;
import com.example.survey.model.ScheduledSlot;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OccurrenceRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant MORNING = Instant.parse("2099-01-01T09:00:00Z");
  private static final Instant EVENING = Instant.parse("2099-01-01T18:00:00Z");
  private static final Instant CLOSING_AT = Instant.parse("2099-01-03T12:00:00Z");

  @Autowired private OccurrenceRepository occurrenceRepository;

  @BeforeEach
  void cleanup() {
    occurrenceRepository.deleteAll();
  }

  @Test
  void duplicateKeyIsIgnored() {
    final Occurrence occurrence = periodic("r-1", MORNING);

    assertThat(occurrenceRepository.insert(occurrence)).isTrue();
    assertThat(occurrenceRepository.insert(occurrence)).isFalse();
    assertThat(occurrenceRepository.findByRecipientId("r-1")).containsExactly(occurrence);
  }

  @Test
  void slotLookupReturnsEveryRecipientOfThatKind() {
    occurrenceRepository.insertAll(
        List.of(
            periodic("r-2", MORNING),
            periodic("r-1", MORNING),
            periodic("r-1", EVENING),
            new Occurrence("r-3", MORNING, NotificationKind.CLOSING, 0, 1)));

    assertThat(occurrenceRepository.findByTimestampAndKind(MORNING, NotificationKind.PERIODIC))
        .extracting(Occurrence::recipientId)
        .containsExactly("r-1", "r-2");
    assertThat(occurrenceRepository.findByTimestampAndKind(MORNING, NotificationKind.CLOSING))
        .singleElement()
        .extracting(Occurrence::distributionIndex)
        .isEqualTo(1);
  }

  @Test
  void distinctSlotsCollapseSharedTimestamps() {
    occurrenceRepository.insertAll(
        List.of(
            periodic("r-1", MORNING),
            periodic("r-2", MORNING),
            periodic("r-1", EVENING),
            new Occurrence("r-1", CLOSING_AT, NotificationKind.CLOSING, 0, 0)));

    assertThat(occurrenceRepository.findDistinctSlots())
        .containsExactly(
            new ScheduledSlot(MORNING, NotificationKind.PERIODIC),
            new ScheduledSlot(EVENING, NotificationKind.PERIODIC),
            new ScheduledSlot(CLOSING_AT, NotificationKind.CLOSING));
  }

  @Test
  void singleRowCanBeRemovedWithoutTouchingOthers() {
    occurrenceRepository.insertAll(List.of(periodic("r-1", MORNING), periodic("r-1", EVENING)));

    assertThat(occurrenceRepository.delete(new OccurrenceKey("r-1", MORNING, NotificationKind.PERIODIC)))
        .isTrue();
    assertThat(occurrenceRepository.delete(new OccurrenceKey("r-1", MORNING, NotificationKind.PERIODIC)))
        .isFalse();
    assertThat(occurrenceRepository.findOne(new OccurrenceKey("r-1", EVENING, NotificationKind.PERIODIC)))
        .isPresent();
  }

  @Test
  void recipientLookupsAndWithdrawal() {
    occurrenceRepository.insertAll(
        List.of(
            new Occurrence("r-1", MORNING, NotificationKind.PERIODIC, 1, Occurrence.NOT_APPLICABLE),
            new Occurrence("r-1", CLOSING_AT, NotificationKind.CLOSING, 1, 0)));

    assertThat(occurrenceRepository.existsByRecipientId("r-1")).isTrue();
    assertThat(occurrenceRepository.existsByRecipientId("r-2")).isFalse();
    assertThat(occurrenceRepository.findCohort("r-1")).hasValue(1);
    assertThat(occurrenceRepository.findCohort("r-2")).isEmpty();

    assertThat(occurrenceRepository.deleteByRecipientId("r-1")).isEqualTo(2);
    assertThat(occurrenceRepository.existsByRecipientId("r-1")).isFalse();
  }

  private static Occurrence periodic(String recipientId, Instant timestamp) {
    return new Occurrence(recipientId, timestamp, NotificationKind.PERIODIC, 0, Occurrence.NOT_APPLICABLE);
  }
}
