package com.scholary.transcript.artifact;

/**
 * Exception thrown when artifact storage operations fail.
 *
 * <p>This is a runtime exception because storage failures are typically unrecoverable at the
 * job level: the run that hits one fails the job.
 */
public class ArtifactStoreException extends RuntimeException {

  public ArtifactStoreException(String message) {
    super(message);
  }

  public ArtifactStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
