package com.scholary.transcript.job;

/**
 * Immutable per-job settings chosen at submission.
 *
 * @param model transcription model name
 * @param keepSourceLanguage transcribe in the spoken language instead of translating to English
 * @param skipSubtitle produce only the plain transcript
 * @param segmentLengthSeconds segment length used for progress and resume
 */
public record JobConfig(
    String model, boolean keepSourceLanguage, boolean skipSubtitle, int segmentLengthSeconds) {}
