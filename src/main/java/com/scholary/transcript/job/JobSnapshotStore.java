package com.scholary.transcript.job;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for job snapshots.
 *
 * <p>The ledger keeps an in-memory cache on top of this; the store is what survives a restart.
 * {@link #save} must be atomic: after a crash, the previous or the new snapshot is on disk, never
 * a mix.
 */
public interface JobSnapshotStore {

  void save(TranscriptionJob job);

  Optional<TranscriptionJob> load(String jobId);

  List<TranscriptionJob> loadAll();

  void delete(String jobId);
}
