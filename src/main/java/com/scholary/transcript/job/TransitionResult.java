package com.scholary.transcript.job;

/**
 * Outcome of {@link JobLedger#update}.
 *
 * @param applied whether the mutation was committed
 * @param job the committed snapshot after the call (unchanged when rejected)
 * @param rejectionReason why the mutation was rejected, or {@code null}
 */
public record TransitionResult(boolean applied, TranscriptionJob job, String rejectionReason) {

  static TransitionResult applied(TranscriptionJob job) {
    return new TransitionResult(true, job, null);
  }

  static TransitionResult rejected(TranscriptionJob job, String reason) {
    return new TransitionResult(false, job, reason);
  }
}
