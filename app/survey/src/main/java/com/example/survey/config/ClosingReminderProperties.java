package com.example.survey.config;

import java.time.Duration;

public record ClosingReminderProperties(boolean enabled, Duration delay) {}
