package com.example.survey.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OccurrenceListResponse(String recipientId, List<OccurrenceSummary> occurrences) {
  public OccurrenceListResponse {
    occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
  }
}
