package com.scholary.transcript.decode;

import java.nio.file.Path;

/**
 * A decoded audio stream ready for segmentation.
 *
 * <p>{@code file} is a 16 kHz mono WAV produced by the decoder; it lives in the run's scratch
 * directory and is deleted when the run ends.
 */
public record DecodedAudio(Path file, double durationSeconds) {}
