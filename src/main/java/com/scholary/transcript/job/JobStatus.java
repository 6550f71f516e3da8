package com.scholary.transcript.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a transcription job.
 *
 * <pre>
 * queued ──► processing ──► completed
 *   │          │  ▲    │
 *   │          ▼  │    └──► error
 *   │         paused ─────► error
 *   └───────────────────────► error
 * </pre>
 *
 * <p>{@code completed} and {@code error} are terminal. Paused jobs can only be failed by the
 * operator cancel path.
 */
public enum JobStatus {
  QUEUED,
  PROCESSING,
  PAUSED,
  COMPLETED,
  ERROR;

  /** Whether a job in this state may move to {@code next}. */
  public boolean canTransitionTo(JobStatus next) {
    return allowedNext().contains(next);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  private Set<JobStatus> allowedNext() {
    return switch (this) {
      case QUEUED -> Set.of(PROCESSING, ERROR);
      case PROCESSING -> Set.of(PAUSED, COMPLETED, ERROR);
      case PAUSED -> Set.of(PROCESSING, ERROR);
      case COMPLETED, ERROR -> Set.of();
    };
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromWireName(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
