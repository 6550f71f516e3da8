package com.scholary.transcript.retention;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for output retention.
 *
 * @param policy when completed outputs become eligible for purging
 * @param retrievalGrace how long outputs stay after the first download
 * @param outputRetention how long finished jobs are kept at most
 * @param sweepInterval delay between sweeps
 */
@ConfigurationProperties(prefix = "retention")
@Validated
public record RetentionProperties(
    @NotNull RetentionPolicy policy,
    @NotNull Duration retrievalGrace,
    @NotNull Duration outputRetention,
    @NotNull Duration sweepInterval) {}
