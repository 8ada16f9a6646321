/*
 * Where: Survey application configuration binding
 * What: Holds retention cleanup settings for tracked link messages
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.survey.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "survey.retention")
public record SurveyRetentionProperties(
                boolean enabled,
                int retentionDays,
                Duration cleanupInterval) {
}
