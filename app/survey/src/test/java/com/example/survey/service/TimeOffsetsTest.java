package com.example.survey.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class TimeOffsetsTest {

  private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
  // ベルリン現地時刻 2024-03-01 12:00
  private static final Instant NOW = Instant.parse("2024-03-01T11:00:00Z");

  @Test
  void sameLocalTimeHasNoOffset() {
    assertThat(TimeOffsets.offsetSeconds(LocalDateTime.of(2024, 3, 1, 12, 0), NOW, BERLIN)).isZero();
  }

  @Test
  void participantBehindStudyZoneIsPositive() {
    assertThat(TimeOffsets.offsetSeconds(LocalDateTime.of(2024, 3, 1, 6, 0), NOW, BERLIN))
        .isEqualTo(6 * 3600L);
  }

  @Test
  void participantAheadOfStudyZoneIsNegative() {
    assertThat(TimeOffsets.offsetSeconds(LocalDateTime.of(2024, 3, 1, 17, 30), NOW, BERLIN))
        .isEqualTo(-(5 * 3600L + 1800L));
  }

  @Test
  void typingDelayIsRoundedAway() {
    assertThat(TimeOffsets.offsetSeconds(LocalDateTime.of(2024, 3, 1, 8, 56), NOW.plusSeconds(42), BERLIN))
        .isEqualTo(3 * 3600L);
  }

  @Test
  void offsetAcrossMidnightKeepsDate() {
    assertThat(TimeOffsets.offsetSeconds(LocalDateTime.of(2024, 2, 29, 23, 0), NOW, BERLIN))
        .isEqualTo(13 * 3600L);
  }
}
