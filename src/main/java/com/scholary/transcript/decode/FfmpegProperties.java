package com.scholary.transcript.decode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>{@code sampleRate} and {@code channels} describe the WAV handed to the engine; Whisper models
 * expect 16 kHz mono.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int timeoutSeconds) {}
