package com.example.survey.api;

import com.example.survey.model.EnrollmentRequest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDateTime;
import java.time.LocalTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrollmentRequestBody(
    @NotBlank String recipientId,
    @PositiveOrZero Integer cohort,
    LocalTime wakeupTime,
    LocalDateTime reportedLocalTime) {

  EnrollmentRequest toRequest() {
    return new EnrollmentRequest(recipientId, cohort, wakeupTime, reportedLocalTime);
  }
}
