package com.scholary.transcript.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.transcript.artifact.ArtifactLocation;
import java.time.Instant;

/**
 * Durable record of a transcription job.
 *
 * <p>Instances are only mutated inside {@link JobLedger#update}, on a private working copy. The
 * state-changing methods here enforce the state machine and monotonic progress; everything the
 * ledger hands out is a copy.
 *
 * <p>Serialized as {@code job.json} by {@link FileJobSnapshotStore}.
 */
public class TranscriptionJob {

  private String id;
  private JobConfig config;
  private JobStatus status;
  private int progress; // 0-100
  private String message;
  private boolean pauseRequested;
  private String originalFilename;
  private ArtifactLocation inputLocation;
  private ArtifactLocation transcriptLocation;
  private ArtifactLocation subtitleLocation;
  private int completedSegments;
  private int totalSegments;
  private Instant createdAt;
  private Instant updatedAt;
  private Instant finishedAt;
  private Instant outputRetrievedAt;

  /** For Jackson. */
  TranscriptionJob() {}

  public TranscriptionJob(
      String id,
      JobConfig config,
      String originalFilename,
      ArtifactLocation inputLocation,
      Instant createdAt) {
    this.id = id;
    this.config = config;
    this.originalFilename = originalFilename;
    this.inputLocation = inputLocation;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
    this.status = JobStatus.QUEUED;
    this.progress = 0;
    this.message = "Queued";
  }

  /**
   * Move to {@code next}.
   *
   * @throws IllegalTransitionException if the state machine forbids it
   */
  public void transitionTo(JobStatus next, String message, Instant now) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalTransitionException(id, status, "move to " + next.wireName());
    }
    status = next;
    this.message = message;
    if (next != JobStatus.PROCESSING) {
      pauseRequested = false;
    }
    if (next.isTerminal()) {
      finishedAt = now;
    }
  }

  /**
   * Raise progress.
   *
   * @throws IllegalArgumentException if {@code value} is out of range or lower than the current
   *     progress
   */
  public void advanceProgress(int value) {
    if (value < 0 || value > 100) {
      throw new IllegalArgumentException("Progress out of range: " + value);
    }
    if (value < progress) {
      throw new IllegalArgumentException(
          String.format("Progress may not decrease: %d -> %d", progress, value));
    }
    progress = value;
  }

  /** A job is paused exactly when its status says so; a pending request does not count. */
  @JsonIgnore
  public boolean isPaused() {
    return status == JobStatus.PAUSED;
  }

  @JsonIgnore
  public boolean isOutputReady() {
    return status == JobStatus.COMPLETED && transcriptLocation != null;
  }

  @JsonIgnore
  public boolean isSubtitleReady() {
    return status == JobStatus.COMPLETED && subtitleLocation != null;
  }

  public TranscriptionJob copy() {
    TranscriptionJob copy = new TranscriptionJob();
    copy.id = id;
    copy.config = config;
    copy.status = status;
    copy.progress = progress;
    copy.message = message;
    copy.pauseRequested = pauseRequested;
    copy.originalFilename = originalFilename;
    copy.inputLocation = inputLocation;
    copy.transcriptLocation = transcriptLocation;
    copy.subtitleLocation = subtitleLocation;
    copy.completedSegments = completedSegments;
    copy.totalSegments = totalSegments;
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    copy.finishedAt = finishedAt;
    copy.outputRetrievedAt = outputRetrievedAt;
    return copy;
  }

  public String getId() {
    return id;
  }

  public JobConfig getConfig() {
    return config;
  }

  public JobStatus getStatus() {
    return status;
  }

  public int getProgress() {
    return progress;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public boolean isPauseRequested() {
    return pauseRequested;
  }

  public void setPauseRequested(boolean pauseRequested) {
    this.pauseRequested = pauseRequested;
  }

  public String getOriginalFilename() {
    return originalFilename;
  }

  public ArtifactLocation getInputLocation() {
    return inputLocation;
  }

  public void setInputLocation(ArtifactLocation inputLocation) {
    this.inputLocation = inputLocation;
  }

  public ArtifactLocation getTranscriptLocation() {
    return transcriptLocation;
  }

  public void setTranscriptLocation(ArtifactLocation transcriptLocation) {
    this.transcriptLocation = transcriptLocation;
  }

  public ArtifactLocation getSubtitleLocation() {
    return subtitleLocation;
  }

  public void setSubtitleLocation(ArtifactLocation subtitleLocation) {
    this.subtitleLocation = subtitleLocation;
  }

  public int getCompletedSegments() {
    return completedSegments;
  }

  public void setCompletedSegments(int completedSegments) {
    this.completedSegments = completedSegments;
  }

  public int getTotalSegments() {
    return totalSegments;
  }

  public void setTotalSegments(int totalSegments) {
    this.totalSegments = totalSegments;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public Instant getOutputRetrievedAt() {
    return outputRetrievedAt;
  }

  public void setOutputRetrievedAt(Instant outputRetrievedAt) {
    this.outputRetrievedAt = outputRetrievedAt;
  }

  // Jackson setters for fields that are otherwise only changed through the methods above.

  void setId(String id) {
    this.id = id;
  }

  void setConfig(JobConfig config) {
    this.config = config;
  }

  void setStatus(JobStatus status) {
    this.status = status;
  }

  void setProgress(int progress) {
    this.progress = progress;
  }

  void setOriginalFilename(String originalFilename) {
    this.originalFilename = originalFilename;
  }

  void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  void setFinishedAt(Instant finishedAt) {
    this.finishedAt = finishedAt;
  }
}
