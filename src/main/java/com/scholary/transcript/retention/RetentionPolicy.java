package com.scholary.transcript.retention;

/** When the outputs of a completed job may be purged. */
public enum RetentionPolicy {
  /**
   * Shortly after the client first downloads an output. Outputs nobody downloads still expire
   * after the retention window.
   */
  AFTER_RETRIEVAL,
  /** A fixed time after the job finished, whether or not it was downloaded. */
  RETENTION_TIMEOUT
}
