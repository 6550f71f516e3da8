package com.scholary.transcript.artifact;

/**
 * Storage for job inputs, intermediate segment results and outputs.
 *
 * <p>This interface decouples the job runner from the storage backend (local disk, S3, MinIO).
 * Writes are all-or-nothing: a reader never sees a partially written artifact.
 */
public interface ArtifactStore {

  /**
   * Store an artifact, replacing any previous artifact at the same location.
   *
   * @param kind the artifact kind
   * @param jobId the owning job
   * @param filename name within the job's directory for this kind
   * @param bytes the payload
   * @return where the artifact was stored
   * @throws ArtifactStoreException if the write fails
   */
  ArtifactLocation put(ArtifactKind kind, String jobId, String filename, byte[] bytes);

  /**
   * Read an artifact.
   *
   * @param location the artifact location
   * @return the payload
   * @throws ArtifactNotFoundException if nothing is stored at {@code location}
   * @throws ArtifactStoreException if the read fails
   */
  byte[] get(ArtifactLocation location);

  boolean exists(ArtifactLocation location);

  /** Delete an artifact. Deleting a missing artifact is a no-op. */
  void delete(ArtifactLocation location);

  /**
   * Delete every artifact of one kind belonging to a job.
   *
   * @return the number of artifacts deleted
   */
  int deleteAll(ArtifactKind kind, String jobId);
}
