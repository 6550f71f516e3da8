package com.scholary.transcript.decode;

/**
 * Thrown when media cannot be decoded or a segment cannot be cut.
 *
 * <p>A decoding failure before the first segment runs is a validation failure of the job.
 */
public class AudioDecodingException extends RuntimeException {

  public AudioDecodingException(String message) {
    super(message);
  }

  public AudioDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
