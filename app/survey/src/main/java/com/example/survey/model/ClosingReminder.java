package com.example.survey.model;

import java.time.Instant;

public record ClosingReminder(String recipientId, Instant surveyAt, Instant remindAt) {}
