package com.example.survey.job;

import com.example.survey.model.CallbackKind;
import com.example.survey.model.ScheduledJob;

public interface JobHandler {

  CallbackKind callbackKind();

  void handle(ScheduledJob job);
}
