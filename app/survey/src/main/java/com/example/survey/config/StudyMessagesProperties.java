/*
 * Where: Survey application configuration binding
 * What: Holds the message texts sent together with survey links
 * Why: Keep participant-facing wording out of the code
 */
package com.example.survey.config;

public record StudyMessagesProperties(
    String enrollment, String periodic, String closing, String closingReminder) {}
