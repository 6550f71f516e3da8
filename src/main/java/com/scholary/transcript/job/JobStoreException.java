package com.scholary.transcript.job;

/** Thrown when a job snapshot cannot be read or written. */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
