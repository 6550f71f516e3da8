package com.scholary.transcript.runner;

/**
 * Thrown when a segment still fails after the last allowed attempt.
 *
 * <p>The job runner turns this into an {@code error} transition carrying the engine's reason.
 */
public class SegmentFailedException extends RuntimeException {

  private final int segmentIndex;
  private final int attempts;

  public SegmentFailedException(int segmentIndex, int attempts, Throwable cause) {
    super(
        String.format(
            "Segment %d failed after %d attempt(s): %s",
            segmentIndex, attempts, cause.getMessage()),
        cause);
    this.segmentIndex = segmentIndex;
    this.attempts = attempts;
  }

  public int getSegmentIndex() {
    return segmentIndex;
  }

  public int getAttempts() {
    return attempts;
  }
}
