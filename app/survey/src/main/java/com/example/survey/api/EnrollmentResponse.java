package com.example.survey.api;

import com.example.survey.model.EnrollmentResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrollmentResponse(String recipientId, EnrollmentResult result) {}
