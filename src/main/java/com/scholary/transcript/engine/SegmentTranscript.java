package com.scholary.transcript.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Engine output for one segment.
 *
 * <p>Persisted as a chunk artifact after each segment so a resumed run, possibly in a new
 * process, can rebuild the transcript without calling the engine again.
 *
 * @param segmentIndex index of the segment this transcript belongs to
 * @param segmentStart absolute start of the segment in seconds
 * @param cues timed text, relative to {@code segmentStart}
 */
public record SegmentTranscript(int segmentIndex, double segmentStart, List<TranscriptCue> cues) {

  public SegmentTranscript {
    cues = cues == null ? List.of() : List.copyOf(cues);
  }

  /** Cue texts of this segment, trimmed, blank lines dropped, one per line. */
  @JsonIgnore
  public String text() {
    return cues.stream()
        .map(cue -> cue.text() == null ? "" : cue.text().strip())
        .filter(text -> !text.isEmpty())
        .collect(Collectors.joining("\n"));
  }
}
