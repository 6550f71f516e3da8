package com.scholary.transcript.retention;

import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactStore;
import com.scholary.transcript.artifact.ArtifactStoreException;
import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.TranscriptionJob;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Purges finished jobs whose retention has run out.
 *
 * <p>Purging deletes every artifact of the job and then its record, after which status and
 * output requests for it answer not-found. Jobs that are still queued, processing or paused are
 * never touched, and polling a job does not shorten its retention.
 */
@Component
public class RetentionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);

  private final JobLedger ledger;
  private final ArtifactStore artifactStore;
  private final RetentionProperties properties;
  private final Clock clock;

  public RetentionSweeper(
      JobLedger ledger, ArtifactStore artifactStore, RetentionProperties properties, Clock clock) {
    this.ledger = ledger;
    this.artifactStore = artifactStore;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Run one sweep.
   *
   * @return the number of jobs purged
   */
  @Scheduled(
      fixedDelayString = "${retention.sweep-interval}",
      initialDelayString = "${retention.sweep-interval}")
  public int sweep() {
    Instant now = clock.instant();
    int purged = 0;

    for (TranscriptionJob job : ledger.list()) {
      Instant expiry = expiry(job);
      if (expiry == null || now.isBefore(expiry)) {
        continue;
      }
      try {
        purge(job);
        purged++;
      } catch (ArtifactStoreException e) {
        LOGGER.warn("Purge of job {} failed, will retry: {}", job.getId(), e.getMessage());
      }
    }

    if (purged > 0) {
      LOGGER.info("Retention sweep purged {} job(s)", purged);
    }
    return purged;
  }

  /** When the job becomes eligible for purging, or {@code null} if it is not finished. */
  Instant expiry(TranscriptionJob job) {
    if (job.getFinishedAt() == null) {
      return null;
    }
    Instant retentionEnd = job.getFinishedAt().plus(properties.outputRetention());
    if (job.getStatus() == JobStatus.ERROR) {
      return retentionEnd;
    }
    if (job.getStatus() != JobStatus.COMPLETED) {
      return null;
    }
    if (properties.policy() == RetentionPolicy.AFTER_RETRIEVAL
        && job.getOutputRetrievedAt() != null) {
      Instant graceEnd = job.getOutputRetrievedAt().plus(properties.retrievalGrace());
      return graceEnd.isBefore(retentionEnd) ? graceEnd : retentionEnd;
    }
    return retentionEnd;
  }

  private void purge(TranscriptionJob job) {
    int deleted = 0;
    for (ArtifactKind kind : ArtifactKind.values()) {
      deleted += artifactStore.deleteAll(kind, job.getId());
    }
    ledger.remove(job.getId());
    LOGGER.info(
        "Purged job: jobId={}, status={}, artifacts={}",
        job.getId(),
        job.getStatus().wireName(),
        deleted);
  }
}
