package com.example.survey.model;

// 復旧時のオペレータ判断。部分復旧は持たず、全件に対する二択とする
public enum RecoveryDecision {
  RESCHEDULE,
  DISCARD
}
