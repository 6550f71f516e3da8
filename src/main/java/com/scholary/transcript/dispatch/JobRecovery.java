package com.scholary.transcript.dispatch;

import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.TranscriptionJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Restarts work that was in flight when the process stopped.
 *
 * <p>Queued and processing jobs are dispatched again; the runner resumes each one from its last
 * committed segment. Paused jobs stay paused until a client resumes them.
 */
@Component
public class JobRecovery {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRecovery.class);

  private final JobLedger ledger;
  private final JobDispatcher dispatcher;

  public JobRecovery(JobLedger ledger, JobDispatcher dispatcher) {
    this.ledger = ledger;
    this.dispatcher = dispatcher;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void recover() {
    int recovered = 0;
    for (TranscriptionJob job : ledger.list()) {
      if (job.getStatus() == JobStatus.QUEUED || job.getStatus() == JobStatus.PROCESSING) {
        LOGGER.info(
            "Recovering job: jobId={}, status={}, completedSegments={}",
            job.getId(),
            job.getStatus().wireName(),
            job.getCompletedSegments());
        dispatcher.dispatch(job.getId());
        recovered++;
      }
    }
    if (recovered > 0) {
      LOGGER.info("Recovered {} unfinished job(s)", recovered);
    }
  }
}
