package com.scholary.transcript.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * @param currentStatus the job's unchanged status when a transition was rejected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    Instant timestamp, int status, String error, String message, String currentStatus) {}
