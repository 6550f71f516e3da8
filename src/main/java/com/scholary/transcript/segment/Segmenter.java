package com.scholary.transcript.segment;

import com.scholary.transcript.decode.DecodedAudio;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed-length segmentation of a decoded audio stream.
 *
 * <p>Splits the stream into back-to-back segments of {@code segmentLengthSeconds}. The last
 * segment may be shorter; a zero-length remainder is dropped. Boundaries are computed in whole
 * milliseconds, so the same stream and length always produce the same list. Resume-from-index
 * depends on that.
 *
 * <p>Example with 30s segments over a 75s stream:
 *
 * <pre>
 * Segment 0: 0:00 - 0:30
 * Segment 1: 0:30 - 1:00
 * Segment 2: 1:00 - 1:15
 * </pre>
 */
@Component
public class Segmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(Segmenter.class);

  public List<Segment> segment(DecodedAudio audio, int segmentLengthSeconds) {
    return segment(audio.durationSeconds(), segmentLengthSeconds);
  }

  /**
   * Plan the segments of a stream of the given duration.
   *
   * @param durationSeconds total stream duration
   * @param segmentLengthSeconds target segment length
   * @return ordered segments covering the whole stream
   * @throws IllegalArgumentException if the stream is empty or the length is not positive
   */
  public List<Segment> segment(double durationSeconds, int segmentLengthSeconds) {
    if (segmentLengthSeconds <= 0) {
      throw new IllegalArgumentException(
          "Segment length must be positive: " + segmentLengthSeconds);
    }
    long totalMillis = Math.round(durationSeconds * 1000);
    if (totalMillis <= 0) {
      throw new IllegalArgumentException("Audio stream is empty");
    }

    long lengthMillis = segmentLengthSeconds * 1000L;
    List<Segment> segments = new ArrayList<>();
    long startMillis = 0;
    int index = 0;

    while (startMillis < totalMillis) {
      long endMillis = Math.min(startMillis + lengthMillis, totalMillis);
      segments.add(new Segment(index, startMillis / 1000.0, endMillis / 1000.0));
      startMillis = endMillis;
      index++;
    }

    LOGGER.debug(
        "Planned {} segments: duration={}s, segmentLength={}s",
        segments.size(),
        durationSeconds,
        segmentLengthSeconds);
    return segments;
  }
}
