package com.scholary.transcript.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.scholary.transcript.artifact.ArtifactLocation;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative store of job records.
 *
 * <p>Uses a Caffeine cache in front of a durable {@link JobSnapshotStore}. Every change goes
 * through {@link #update}, which holds a per-job lock, applies the mutation to a working copy,
 * persists it and only then publishes it. Readers get copies of the last committed snapshot, so
 * they never observe a half-applied change.
 *
 * <p>Locks are held in a weak-valued Caffeine cache keyed by job id: operations on different jobs
 * never contend, and locks for idle jobs are collected.
 */
public class JobLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobLedger.class);

  private final JobSnapshotStore snapshotStore;
  private final Clock clock;
  private final Cache<String, TranscriptionJob> cache;
  private final LoadingCache<String, ReentrantLock> locks;

  public JobLedger(JobSnapshotStore snapshotStore, JobStoreProperties properties, Clock clock) {
    this.snapshotStore = snapshotStore;
    this.clock = clock;
    this.cache = Caffeine.newBuilder().maximumSize(properties.maxSize()).build();
    this.locks = Caffeine.newBuilder().weakValues().build(jobId -> new ReentrantLock());
  }

  /**
   * Create a queued job.
   *
   * @throws IllegalStateException if a job with this id already exists
   */
  public TranscriptionJob create(
      String jobId, JobConfig config, String originalFilename, ArtifactLocation input) {
    ReentrantLock lock = locks.get(jobId);
    lock.lock();
    try {
      if (load(jobId) != null) {
        throw new IllegalStateException("Job already exists: " + jobId);
      }
      TranscriptionJob job =
          new TranscriptionJob(jobId, config, originalFilename, input, clock.instant());
      commit(job);
      LOGGER.info("Job created: jobId={}, model={}", jobId, config.model());
      return job.copy();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Current snapshot of a job.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  public TranscriptionJob get(String jobId) {
    return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  public Optional<TranscriptionJob> find(String jobId) {
    return Optional.ofNullable(load(jobId)).map(TranscriptionJob::copy);
  }

  /**
   * Atomically apply a mutation to one job.
   *
   * <p>If the mutation throws {@link IllegalTransitionException} nothing is written and the
   * result carries the unchanged snapshot. Any other exception propagates, also without a write.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  public TransitionResult update(String jobId, JobMutation mutation) {
    ReentrantLock lock = locks.get(jobId);
    lock.lock();
    try {
      TranscriptionJob current = load(jobId);
      if (current == null) {
        throw new JobNotFoundException(jobId);
      }

      TranscriptionJob working = current.copy();
      try {
        mutation.apply(working);
      } catch (IllegalTransitionException e) {
        LOGGER.debug("Mutation rejected: jobId={}, reason={}", jobId, e.getMessage());
        return TransitionResult.rejected(current.copy(), e.getMessage());
      }

      working.setUpdatedAt(clock.instant());
      commit(working);
      return TransitionResult.applied(working.copy());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Ask a processing job to pause at the next segment boundary.
   *
   * <p>Only legal while processing. Repeating the request while it is pending is accepted and
   * changes nothing.
   */
  public TransitionResult requestPause(String jobId) {
    return update(
        jobId,
        job -> {
          if (job.getStatus() != JobStatus.PROCESSING) {
            throw new IllegalTransitionException(jobId, job.getStatus(), "pause");
          }
          job.setPauseRequested(true);
          job.setMessage("Pause requested");
        });
  }

  /** Move a paused job back to processing. Only legal while paused. */
  public TransitionResult requestResume(String jobId) {
    return update(
        jobId,
        job -> {
          if (job.getStatus() != JobStatus.PAUSED) {
            throw new IllegalTransitionException(jobId, job.getStatus(), "resume");
          }
          job.transitionTo(JobStatus.PROCESSING, "Resuming", clock.instant());
        });
  }

  /** Snapshots of every persisted job, including those evicted from the cache. */
  public List<TranscriptionJob> list() {
    return snapshotStore.loadAll().stream()
        .map(job -> find(job.getId()).orElse(job))
        .toList();
  }

  /** Forget a job entirely. Removing an unknown job is a no-op. */
  public void remove(String jobId) {
    ReentrantLock lock = locks.get(jobId);
    lock.lock();
    try {
      snapshotStore.delete(jobId);
      cache.invalidate(jobId);
      LOGGER.info("Job removed: jobId={}", jobId);
    } finally {
      lock.unlock();
    }
  }

  private TranscriptionJob load(String jobId) {
    return cache.get(jobId, id -> snapshotStore.load(id).orElse(null));
  }

  private void commit(TranscriptionJob job) {
    snapshotStore.save(job);
    cache.put(job.getId(), job);
  }
}
