package com.example.survey.recovery;

import com.example.survey.model.RecoveryDecision;

// decision は判断対象がなかった場合 null
public record RecoveryResult(
    int storedSlots, int pastSlots, int alreadyLive, int registered, int discardedRows, RecoveryDecision decision) {

  public static RecoveryResult nothingToRecover(int storedSlots, int pastSlots, int alreadyLive) {
    return new RecoveryResult(storedSlots, pastSlots, alreadyLive, 0, 0, null);
  }
}
