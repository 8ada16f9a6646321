package com.example.survey.api;

public class OccurrenceNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public OccurrenceNotFoundException(String message) {
    super(message);
  }
}
