package com.example.survey.model;

public enum EnrollmentResult {
  TOO_EARLY,
  TOO_LATE,
  ALREADY_ENROLLED,
  ENROLLED
}
