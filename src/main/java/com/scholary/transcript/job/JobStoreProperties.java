package com.scholary.transcript.job;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job ledger.
 *
 * <p>{@code maxSize} bounds the in-memory cache only. Evicted jobs are reloaded from their
 * snapshot on the next read.
 */
@ConfigurationProperties(prefix = "jobstore")
@Validated
public record JobStoreProperties(@Positive int maxSize) {}
