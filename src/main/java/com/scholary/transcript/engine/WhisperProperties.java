package com.scholary.transcript.engine;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper HTTP service.
 *
 * <p>Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @NotBlank String transcribePath,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
