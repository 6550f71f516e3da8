package com.scholary.transcript.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single timed line of transcribed speech.
 *
 * <p>Engine responses carry times relative to the segment that was sent; the assembler shifts
 * them by the segment's start to get absolute times.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptCue(double start, double end, String text) {}
