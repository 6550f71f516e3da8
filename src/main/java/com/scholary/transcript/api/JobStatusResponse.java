package com.scholary.transcript.api;

import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.TranscriptionJob;

/**
 * Response for job status query.
 *
 * <p>{@code paused} is true only once the runner has actually stopped; a pending pause request
 * shows as {@code processing} with a "Pause requested" message. Output fields are set only after
 * the job has completed.
 */
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    int progress,
    String message,
    boolean paused,
    boolean outputReady,
    String outputLocation,
    boolean subtitleReady,
    String subtitleFilename,
    String model,
    boolean keepSourceLanguage,
    boolean skipSubtitle,
    int segmentsCompleted,
    int segmentsTotal) {

  public static JobStatusResponse from(TranscriptionJob job) {
    boolean outputReady = job.isOutputReady();
    return new JobStatusResponse(
        job.getId(),
        job.getStatus(),
        job.getProgress(),
        job.getMessage(),
        job.isPaused(),
        outputReady,
        outputReady ? job.getTranscriptLocation().key() : null,
        job.isSubtitleReady(),
        job.isSubtitleReady() ? job.getSubtitleLocation().filename() : null,
        job.getConfig().model(),
        job.getConfig().keepSourceLanguage(),
        job.getConfig().skipSubtitle(),
        job.getCompletedSegments(),
        job.getTotalSegments());
  }
}
