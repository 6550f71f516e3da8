package com.scholary.transcript.service;

/** Thrown when a submission is rejected before any job is created. */
public class JobValidationException extends RuntimeException {

  public JobValidationException(String message) {
    super(message);
  }
}
