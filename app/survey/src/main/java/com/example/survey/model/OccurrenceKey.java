package com.example.survey.model;

import java.time.Instant;

public record OccurrenceKey(String recipientId, Instant timestamp, NotificationKind kind) {}
