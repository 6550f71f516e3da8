package com.scholary.transcript.engine;

/**
 * Speech-to-text for a single segment.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the job
 * runner. Implementations make exactly one attempt; the runner owns retries.
 */
public interface TranscriptionEngine {

  /**
   * Transcribe one segment.
   *
   * @param audio the segment and its audio file
   * @param model the model name, e.g. {@code medium}
   * @param mode translate to English or keep the source language
   * @return the segment's timed text
   * @throws TranscriptionEngineException if this attempt failed
   */
  SegmentTranscript transcribe(SegmentAudio audio, String model, LanguageMode mode);
}
