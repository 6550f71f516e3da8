package com.scholary.transcript.dispatch;

import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobNotFoundException;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.TransitionResult;
import com.scholary.transcript.runner.JobRunner;
import com.scholary.transcript.runner.RunOutcome;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Starts job runners on the task executor, at most one per job.
 *
 * <p>Each active job owns a slot in a concurrent map. A dispatch that finds the slot taken only
 * marks it for a re-run; the thread holding the slot runs the job once more before releasing it.
 * Slot creation, re-run marking and release all happen inside {@code compute} for the job id,
 * so a request that arrives while a runner is finishing causes exactly one further run.
 */
@Component
public class JobDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobDispatcher.class);

  private final JobRunner runner;
  private final JobLedger ledger;
  private final Executor executor;
  private final Clock clock;
  private final ConcurrentMap<String, RunnerSlot> slots = new ConcurrentHashMap<>();

  public JobDispatcher(
      JobRunner runner,
      JobLedger ledger,
      @Qualifier("taskExecutor") Executor executor,
      Clock clock) {
    this.runner = runner;
    this.ledger = ledger;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Make sure a runner will look at this job.
   *
   * <p>Starts one if none is active; otherwise the active runner's thread runs the job again
   * after the current run ends.
   */
  public void dispatch(String jobId) {
    boolean[] created = {false};
    slots.compute(
        jobId,
        (id, slot) -> {
          if (slot != null) {
            slot.rerunRequested = true;
            return slot;
          }
          created[0] = true;
          return new RunnerSlot();
        });

    if (!created[0]) {
      LOGGER.debug("Runner already active for job {}, re-run scheduled", jobId);
      return;
    }

    try {
      executor.execute(() -> runLoop(jobId));
      LOGGER.debug("Runner submitted for job {}", jobId);
    } catch (RejectedExecutionException e) {
      slots.remove(jobId);
      LOGGER.error("Executor rejected runner for job {}", jobId, e);
      failRejected(jobId);
    }
  }

  /** Whether a runner currently owns this job. */
  public boolean isActive(String jobId) {
    return slots.containsKey(jobId);
  }

  private void runLoop(String jobId) {
    boolean again;
    do {
      try {
        RunOutcome outcome = runner.run(jobId);
        LOGGER.info("Runner finished: jobId={}, outcome={}", jobId, outcome);
      } catch (RuntimeException e) {
        LOGGER.error("Runner crashed: jobId={}", jobId, e);
      }

      boolean[] rerun = {false};
      slots.computeIfPresent(
          jobId,
          (id, slot) -> {
            if (slot.rerunRequested) {
              slot.rerunRequested = false;
              rerun[0] = true;
              return slot;
            }
            return null;
          });
      again = rerun[0];
    } while (again);
  }

  private void failRejected(String jobId) {
    try {
      TransitionResult result =
          ledger.update(
              jobId,
              job ->
                  job.transitionTo(
                      JobStatus.ERROR,
                      "Server is busy: no worker available to run the job",
                      clock.instant()));
      if (!result.applied()) {
        LOGGER.warn("Could not fail rejected job {}: {}", jobId, result.rejectionReason());
      }
    } catch (JobNotFoundException e) {
      LOGGER.warn("Rejected job {} no longer exists", jobId);
    }
  }

  /** Mutated only inside {@code compute} calls for its key. */
  private static final class RunnerSlot {
    private boolean rerunRequested;
  }
}
