package com.scholary.transcript.runner;

import com.scholary.transcript.engine.SegmentTranscript;
import com.scholary.transcript.engine.TranscriptCue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds the job outputs from per-segment transcripts.
 *
 * <p>Segments are concatenated in index order. Segments never overlap, so no de-duplication is
 * needed; cue timings are shifted by each segment's start to make them absolute.
 */
@Component
public class TranscriptWriter {

  /**
   * Plain transcript: the text of each segment, in order, one cue per line.
   *
   * @return the transcript, empty if no segment produced text
   */
  public String writeTranscript(List<SegmentTranscript> segments) {
    return inOrder(segments).stream()
        .map(SegmentTranscript::text)
        .filter(text -> !text.isEmpty())
        .collect(Collectors.joining("\n"))
        .strip();
  }

  /**
   * Write transcript as SRT (SubRip subtitle format).
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:05,200
   * Hello world
   *
   * 2
   * 00:00:05,200 --> 00:00:10,300
   * This is a test
   * </pre>
   *
   * <p>Cues without text are skipped and numbering stays consecutive.
   *
   * @return the SRT document, empty if there are no cues with text
   */
  public String writeSrt(List<SegmentTranscript> segments) {
    List<String> lines = new ArrayList<>();
    int sequence = 1;

    for (TranscriptCue cue : absoluteCues(segments)) {
      String text = cue.text() == null ? "" : cue.text().strip();
      if (text.isEmpty()) {
        continue;
      }
      lines.add(String.valueOf(sequence++));
      lines.add(formatSrtTime(cue.start()) + " --> " + formatSrtTime(cue.end()));
      lines.add(text);
      lines.add("");
    }

    if (lines.isEmpty()) {
      return "";
    }
    return String.join("\n", lines).strip() + "\n";
  }

  /** Cues of all segments in order, with times relative to the start of the stream. */
  public List<TranscriptCue> absoluteCues(List<SegmentTranscript> segments) {
    List<TranscriptCue> cues = new ArrayList<>();
    for (SegmentTranscript segment : inOrder(segments)) {
      for (TranscriptCue cue : segment.cues()) {
        cues.add(
            new TranscriptCue(
                segment.segmentStart() + cue.start(),
                segment.segmentStart() + cue.end(),
                cue.text()));
      }
    }
    return cues;
  }

  /**
   * Format a time in seconds as SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm. Rounded to the nearest millisecond.
   */
  static String formatSrtTime(double seconds) {
    long totalMillis = Math.round(seconds * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  private static List<SegmentTranscript> inOrder(List<SegmentTranscript> segments) {
    return segments.stream()
        .sorted(Comparator.comparingInt(SegmentTranscript::segmentIndex))
        .toList();
  }
}
