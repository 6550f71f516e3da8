package com.scholary.transcript.segment;

/**
 * A contiguous, time-bounded slice of decoded audio.
 *
 * <p>Segments are ordered by {@code index}; transcript text is always assembled in index order.
 * All times are in seconds from the start of the stream.
 */
public record Segment(int index, double startSeconds, double endSeconds) {

  public Segment {
    if (index < 0) {
      throw new IllegalArgumentException("Segment index cannot be negative");
    }
    if (startSeconds < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endSeconds <= startSeconds) {
      throw new IllegalArgumentException("End time must be > start time");
    }
  }

  public double duration() {
    return endSeconds - startSeconds;
  }
}
