package com.scholary.transcript.job;

/**
 * Thrown when an operation is not allowed in the job's current state.
 *
 * <p>Carries the current status so callers can report it back.
 */
public class IllegalTransitionException extends RuntimeException {

  private final String jobId;
  private final JobStatus currentStatus;

  public IllegalTransitionException(String jobId, JobStatus currentStatus, String operation) {
    super(
        String.format(
            "Cannot %s job %s while it is %s", operation, jobId, currentStatus.wireName()));
    this.jobId = jobId;
    this.currentStatus = currentStatus;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getCurrentStatus() {
    return currentStatus;
  }
}
