package com.scholary.transcript.runner;

/** How a single runner activation ended. */
public enum RunOutcome {
  /** Outputs written and the job committed as completed. */
  COMPLETED,
  /** A pending pause request was honored at a segment boundary. */
  PAUSED,
  /** The job was moved to error. */
  FAILED,
  /** Nothing to do: the job was already terminal or paused. */
  SKIPPED,
  /** The job turned terminal underneath the runner, e.g. operator cancel. */
  CANCELLED
}
