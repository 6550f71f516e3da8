package com.scholary.transcript.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for transcription processing.
 *
 * <p>Controls default values, accepted models, and resource allocation for transcription jobs.
 * {@code workDir} holds job snapshots, local artifacts and per-run scratch space.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    @NotBlank String workDir,
    @Positive int defaultSegmentLengthSeconds,
    @NotBlank String defaultModel,
    @NotEmpty List<String> models,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {}
