package com.scholary.transcript.runner;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job runner.
 *
 * <p>A segment is attempted up to {@code segmentMaxAttempts} times. Before attempt {@code n + 1}
 * the runner waits {@code retryBackoff * n}.
 */
@ConfigurationProperties(prefix = "runner")
@Validated
public record RunnerProperties(@Positive int segmentMaxAttempts, @NotNull Duration retryBackoff) {}
