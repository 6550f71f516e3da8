package com.scholary.transcript.decode;

import com.scholary.transcript.segment.Segment;
import java.nio.file.Path;

/**
 * Turns uploaded media into audio the transcription engine can consume.
 *
 * <p>Implementations are free to shell out (ffmpeg) or decode in-process. Tests use a stub that
 * reports a fixed duration without touching the file.
 */
public interface AudioDecoder {

  /**
   * Decode an input media file into a single audio stream.
   *
   * @param inputFile the uploaded media
   * @param scratchDir directory the decoder may write into
   * @return the decoded stream and its duration
   * @throws AudioDecodingException if the media cannot be decoded
   */
  DecodedAudio decode(Path inputFile, Path scratchDir);

  /**
   * Cut one segment out of a decoded stream.
   *
   * @param audio the decoded stream
   * @param segment the time range to extract
   * @param target where to write the segment audio
   * @return the written file
   * @throws AudioDecodingException if extraction fails
   */
  Path extract(DecodedAudio audio, Segment segment, Path target);
}
