package com.example.survey.recovery;

import com.example.survey.model.RecoveryDecision;

public class FixedRecoveryDecisionProvider implements RecoveryDecisionProvider {

  private final RecoveryDecision decision;

  public FixedRecoveryDecisionProvider(RecoveryDecision decision) {
    this.decision = decision;
  }

  @Override
  public RecoveryDecision decide(int futureSlotCount) {
    return decision;
  }
}
