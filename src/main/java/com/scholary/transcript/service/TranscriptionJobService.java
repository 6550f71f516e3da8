package com.scholary.transcript.service;

import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactLocation;
import com.scholary.transcript.artifact.ArtifactStore;
import com.scholary.transcript.artifact.ArtifactStoreException;
import com.scholary.transcript.config.TranscriptionProperties;
import com.scholary.transcript.dispatch.JobDispatcher;
import com.scholary.transcript.job.IllegalTransitionException;
import com.scholary.transcript.job.JobConfig;
import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.TranscriptionJob;
import com.scholary.transcript.job.TransitionResult;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for everything a client can do with a job.
 *
 * <p>Submission stores the upload as the job's input artifact, creates the job and hands it to
 * the dispatcher. Pause and resume go through the ledger; a successful resume dispatches the job
 * again. Rejected pause, resume and cancel requests raise {@link IllegalTransitionException}
 * carrying the unchanged status.
 */
@Service
public class TranscriptionJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobService.class);

  static final String CANCELLED_MESSAGE = "Cancelled by operator";

  private final JobLedger ledger;
  private final ArtifactStore artifactStore;
  private final JobDispatcher dispatcher;
  private final TranscriptionProperties properties;
  private final Clock clock;

  public TranscriptionJobService(
      JobLedger ledger,
      ArtifactStore artifactStore,
      JobDispatcher dispatcher,
      TranscriptionProperties properties,
      Clock clock) {
    this.ledger = ledger;
    this.artifactStore = artifactStore;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Create a job for an uploaded file and start it.
   *
   * @throws JobValidationException if the upload or settings are invalid; no job is created
   */
  public TranscriptionJob submit(JobSubmission submission, String filename, byte[] content) {
    if (content == null || content.length == 0) {
      throw new JobValidationException("Uploaded file is empty");
    }
    String safeName = sanitizeFilename(filename);
    String model = resolveModel(submission.model());
    int segmentLength =
        submission.segmentLengthSeconds() == null
            ? properties.defaultSegmentLengthSeconds()
            : submission.segmentLengthSeconds();
    if (segmentLength <= 0) {
      throw new JobValidationException("Segment length must be positive: " + segmentLength);
    }

    JobConfig config =
        new JobConfig(
            model, submission.keepSourceLanguage(), submission.skipSubtitle(), segmentLength);
    String jobId = UUID.randomUUID().toString();

    ArtifactLocation input = artifactStore.put(ArtifactKind.INPUT, jobId, safeName, content);
    TranscriptionJob job = ledger.create(jobId, config, safeName, input);
    LOGGER.info(
        "Job submitted: jobId={}, file={}, bytes={}, model={}, keepSourceLanguage={}",
        jobId,
        safeName,
        content.length,
        model,
        config.keepSourceLanguage());

    dispatcher.dispatch(jobId);
    return job;
  }

  /** Current snapshot; unknown or purged ids raise JobNotFoundException. */
  public TranscriptionJob status(String jobId) {
    return ledger.get(jobId);
  }

  /** Ask a processing job to pause after its current segment. */
  public TranscriptionJob pause(String jobId) {
    TransitionResult result = ledger.requestPause(jobId);
    if (!result.applied()) {
      throw new IllegalTransitionException(jobId, result.job().getStatus(), "pause");
    }
    LOGGER.info("Pause requested: jobId={}", jobId);
    return result.job();
  }

  /** Resume a paused job from its last completed segment. */
  public TranscriptionJob resume(String jobId) {
    TransitionResult result = ledger.requestResume(jobId);
    if (!result.applied()) {
      throw new IllegalTransitionException(jobId, result.job().getStatus(), "resume");
    }
    LOGGER.info(
        "Resume requested: jobId={}, fromSegment={}",
        jobId,
        result.job().getCompletedSegments());
    dispatcher.dispatch(jobId);
    return result.job();
  }

  /**
   * Operator cancel: move an unfinished job to {@code error}.
   *
   * <p>A running job stops at its next segment boundary and cleans up after itself. For a job
   * with no active runner the input and intermediate artifacts are removed here.
   */
  public TranscriptionJob cancel(String jobId) {
    TransitionResult result =
        ledger.update(
            jobId,
            job -> {
              if (job.getStatus().isTerminal()) {
                throw new IllegalTransitionException(jobId, job.getStatus(), "cancel");
              }
              job.transitionTo(JobStatus.ERROR, CANCELLED_MESSAGE, clock.instant());
            });
    if (!result.applied()) {
      throw new IllegalTransitionException(jobId, result.job().getStatus(), "cancel");
    }
    LOGGER.info("Job cancelled by operator: jobId={}", jobId);

    if (!dispatcher.isActive(jobId)) {
      try {
        artifactStore.deleteAll(ArtifactKind.INPUT, jobId);
        artifactStore.deleteAll(ArtifactKind.CHUNK, jobId);
      } catch (ArtifactStoreException e) {
        LOGGER.warn(
            "Artifacts of cancelled job {} left for the sweeper: {}", jobId, e.getMessage());
      }
    }
    return result.job();
  }

  /**
   * Download an output of a completed job and record that it was retrieved.
   *
   * @param kind which output, or {@code null} for the subtitle when one was produced and the
   *     transcript otherwise
   * @throws OutputNotAvailableException if the job is not completed or has no such output
   */
  public JobOutput fetchOutput(String jobId, OutputKind kind) {
    TranscriptionJob job = ledger.get(jobId);
    if (!job.isOutputReady()) {
      throw new OutputNotAvailableException(
          String.format("Job %s has no output yet (status %s)", jobId, job.getStatus().wireName()));
    }

    OutputKind resolved = kind;
    if (resolved == null) {
      resolved = job.getSubtitleLocation() != null ? OutputKind.SUBTITLE : OutputKind.TRANSCRIPT;
    }
    ArtifactLocation location =
        resolved == OutputKind.SUBTITLE ? job.getSubtitleLocation() : job.getTranscriptLocation();
    if (location == null) {
      throw new OutputNotAvailableException(
          String.format("Job %s produced no %s", jobId, resolved.name().toLowerCase(Locale.ROOT)));
    }

    byte[] content = artifactStore.get(location);
    ledger.update(
        jobId,
        j -> {
          if (j.getOutputRetrievedAt() == null) {
            j.setOutputRetrievedAt(clock.instant());
          }
        });

    ArtifactKind artifactKind =
        resolved == OutputKind.SUBTITLE ? ArtifactKind.SUBTITLE : ArtifactKind.TRANSCRIPT;
    LOGGER.info("Output retrieved: jobId={}, kind={}, bytes={}", jobId, resolved, content.length);
    return new JobOutput(location.filename(), artifactKind.contentType(), content);
  }

  private String resolveModel(String requested) {
    if (requested == null || requested.isBlank()) {
      return properties.defaultModel();
    }
    String model = requested.strip();
    if (!properties.models().contains(model)) {
      throw new JobValidationException(
          String.format(
              "Unsupported model: %s. Choose one of %s",
              model, String.join(", ", properties.models())));
    }
    return model;
  }

  /** Keep only the last path element and replace characters that are unsafe in a key. */
  static String sanitizeFilename(String filename) {
    if (filename == null || filename.isBlank()) {
      throw new JobValidationException("Uploaded file must have a filename");
    }
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1).strip();
    name = name.replaceAll("[^A-Za-z0-9._ -]", "_").replaceAll("\\.{2,}", ".");
    if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
      throw new JobValidationException("Invalid filename: " + filename);
    }
    return name;
  }
}
