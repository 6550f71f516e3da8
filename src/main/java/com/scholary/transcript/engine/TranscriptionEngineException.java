package com.scholary.transcript.engine;

/**
 * Exception thrown when a single transcription attempt fails.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses. The
 * runner retries the same segment a bounded number of times before failing the job.
 */
public class TranscriptionEngineException extends RuntimeException {

  public TranscriptionEngineException(String message) {
    super(message);
  }

  public TranscriptionEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
