package com.example.survey.recovery;

public enum RecoveryDecisionMode {
  PROMPT,
  RESCHEDULE,
  DISCARD
}
