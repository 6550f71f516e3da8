package com.scholary.transcript.service;

/** Thrown when a job has no output of the requested kind (not finished, or not produced). */
public class OutputNotAvailableException extends RuntimeException {

  public OutputNotAvailableException(String message) {
    super(message);
  }
}
