package com.scholary.transcript.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactLocation;
import com.scholary.transcript.artifact.ArtifactStore;
import com.scholary.transcript.artifact.ArtifactStoreException;
import com.scholary.transcript.config.TranscriptionProperties;
import com.scholary.transcript.decode.AudioDecoder;
import com.scholary.transcript.decode.AudioDecodingException;
import com.scholary.transcript.decode.DecodedAudio;
import com.scholary.transcript.engine.LanguageMode;
import com.scholary.transcript.engine.SegmentAudio;
import com.scholary.transcript.engine.SegmentTranscript;
import com.scholary.transcript.engine.TranscriptionEngine;
import com.scholary.transcript.engine.TranscriptionEngineException;
import com.scholary.transcript.job.IllegalTransitionException;
import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobNotFoundException;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.TranscriptionJob;
import com.scholary.transcript.job.TransitionResult;
import com.scholary.transcript.logging.StructuredLogger;
import com.scholary.transcript.segment.Segment;
import com.scholary.transcript.segment.Segmenter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes one job's segments in order.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Validate a queued job and move it to processing
 *   <li>Decode the input and plan the segments
 *   <li>Resume at the last committed segment, reloading earlier results from chunk artifacts
 *   <li>Before each segment, honor a pending pause or stop if the job went terminal
 *   <li>Transcribe with bounded retries, store the chunk, commit progress
 *   <li>Write transcript and subtitle, then commit completed
 * </ol>
 *
 * <p>The pause check in step 4 is the only place a run suspends. An in-flight engine call is never
 * interrupted. Progress is always committed after the chunk it counts has been stored, so a resume
 * in a new process can rely on the committed segment count.
 *
 * <p>Only one runner may be active per job; {@code JobDispatcher} guarantees that.
 */
@Service
public class JobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String NO_TEXT_MESSAGE = "Transcription produced no text";

  private final JobLedger ledger;
  private final ArtifactStore artifactStore;
  private final AudioDecoder audioDecoder;
  private final Segmenter segmenter;
  private final TranscriptionEngine engine;
  private final TranscriptWriter transcriptWriter;
  private final ObjectMapper objectMapper;
  private final RunnerProperties runnerProperties;
  private final Path scratchRoot;
  private final Clock clock;

  public JobRunner(
      JobLedger ledger,
      ArtifactStore artifactStore,
      AudioDecoder audioDecoder,
      Segmenter segmenter,
      TranscriptionEngine engine,
      TranscriptWriter transcriptWriter,
      ObjectMapper objectMapper,
      RunnerProperties runnerProperties,
      TranscriptionProperties transcriptionProperties,
      Clock clock) {
    this.ledger = ledger;
    this.artifactStore = artifactStore;
    this.audioDecoder = audioDecoder;
    this.segmenter = segmenter;
    this.engine = engine;
    this.transcriptWriter = transcriptWriter;
    this.objectMapper = objectMapper;
    this.runnerProperties = runnerProperties;
    this.scratchRoot = Paths.get(transcriptionProperties.workDir()).resolve("scratch");
    this.clock = clock;
  }

  /**
   * Run a job until it completes, fails, pauses or turns out to need no work.
   *
   * <p>Never throws for job-level failures; those end in an {@code error} transition.
   */
  public RunOutcome run(String jobId) {
    StructuredLogger.setJobContext(jobId);
    try {
      return doRun(jobId);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private RunOutcome doRun(String jobId) {
    Optional<TranscriptionJob> found = ledger.find(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Runner started for unknown job {}", jobId);
      return RunOutcome.SKIPPED;
    }

    TranscriptionJob job = found.get();
    if (job.getStatus().isTerminal() || job.getStatus() == JobStatus.PAUSED) {
      LOGGER.info("Nothing to run: jobId={}, status={}", jobId, job.getStatus().wireName());
      return RunOutcome.SKIPPED;
    }

    if (job.getStatus() == JobStatus.QUEUED) {
      String problem;
      try {
        problem = preflight(job);
      } catch (RuntimeException e) {
        LOGGER.error("Preflight failed: jobId={}", jobId, e);
        return fail(jobId, "Internal error: " + e.getMessage());
      }
      if (problem != null) {
        return fail(jobId, "Validation failed: " + problem);
      }

      TransitionResult started;
      try {
        started =
            ledger.update(
                jobId,
                j -> j.transitionTo(JobStatus.PROCESSING, "Preparing audio", clock.instant()));
      } catch (JobNotFoundException e) {
        LOGGER.warn("Job disappeared before start: {}", jobId);
        return RunOutcome.CANCELLED;
      } catch (RuntimeException e) {
        LOGGER.error("Start transition failed: jobId={}", jobId, e);
        return fail(jobId, "Internal error: " + e.getMessage());
      }
      if (!started.applied()) {
        LOGGER.info("Job changed before start: {}", started.rejectionReason());
        if (started.job().getStatus().isTerminal()) {
          cleanupTransientArtifacts(jobId);
        }
        return RunOutcome.SKIPPED;
      }
      structuredLogger.logStatusChange(jobId, "queued", "processing", "Preparing audio");
      job = started.job();
    }

    Path scratch;
    try {
      Files.createDirectories(scratchRoot);
      scratch = Files.createTempDirectory(scratchRoot, jobId + "-");
    } catch (IOException e) {
      return fail(jobId, "Cannot create scratch directory: " + e.getMessage());
    }

    try {
      return process(job, scratch);

    } catch (SegmentFailedException e) {
      return fail(jobId, e.getCause().getMessage());

    } catch (IllegalArgumentException e) {
      return fail(jobId, "Validation failed: " + e.getMessage());

    } catch (AudioDecodingException e) {
      LOGGER.error("Decoding failed: jobId={}", jobId, e);
      return fail(jobId, "Audio decoding failed: " + e.getMessage());

    } catch (JobNotFoundException e) {
      LOGGER.warn("Job disappeared while running: {}", jobId);
      return RunOutcome.CANCELLED;

    } catch (RuntimeException e) {
      LOGGER.error("Job run failed: jobId={}", jobId, e);
      return fail(jobId, "Internal error: " + e.getMessage());

    } finally {
      deleteRecursively(scratch);
    }
  }

  private RunOutcome process(TranscriptionJob job, Path scratch) {
    String jobId = job.getId();

    DecodedAudio audio = decodeInput(job, scratch);
    List<Segment> segments = segmenter.segment(audio, job.getConfig().segmentLengthSeconds());
    int total = segments.size();

    if (job.getTotalSegments() != total) {
      if (job.getTotalSegments() > 0) {
        LOGGER.warn(
            "Segment count changed between runs: jobId={}, was={}, now={}",
            jobId,
            job.getTotalSegments(),
            total);
      }
      TransitionResult planned = ledger.update(jobId, j -> j.setTotalSegments(total));
      job = planned.job();
    }

    int resumeIndex = Math.min(job.getCompletedSegments(), total);
    if (resumeIndex > 0) {
      LOGGER.info("Resuming job {} at segment {}/{}", jobId, resumeIndex + 1, total);
    }

    List<SegmentTranscript> results = new ArrayList<>(total);
    for (int i = 0; i < resumeIndex; i++) {
      results.add(restoreSegment(job, audio, segments.get(i), scratch));
    }

    for (int i = resumeIndex; i < total; i++) {
      TranscriptionJob current = ledger.get(jobId);
      if (current.getStatus().isTerminal()) {
        LOGGER.info(
            "Job {} went {} while running, stopping", jobId, current.getStatus().wireName());
        cleanupTransientArtifacts(jobId);
        return RunOutcome.CANCELLED;
      }
      if (current.isPauseRequested()) {
        return pause(jobId, i, total);
      }

      Segment segment = segments.get(i);
      SegmentTranscript result = transcribeWithRetry(job, audio, segment, scratch);
      storeChunk(jobId, result);
      results.add(result);

      int segmentsDone = i + 1;
      int progress = (int) Math.round(100.0 * segmentsDone / total);
      TransitionResult committed =
          ledger.update(
              jobId,
              j -> {
                if (j.getStatus() != JobStatus.PROCESSING) {
                  throw new IllegalTransitionException(jobId, j.getStatus(), "record progress of");
                }
                j.advanceProgress(progress);
                j.setCompletedSegments(segmentsDone);
                if (!j.isPauseRequested()) {
                  j.setMessage(String.format("Transcribed segment %d of %d", segmentsDone, total));
                }
              });
      if (!committed.applied()) {
        LOGGER.info(
            "Progress not committed, job {} changed: {}", jobId, committed.rejectionReason());
        cleanupTransientArtifacts(jobId);
        return RunOutcome.CANCELLED;
      }
      structuredLogger.logJobProgress(jobId, segmentsDone, total, progress);
    }

    return complete(job, results, total);
  }

  private RunOutcome pause(String jobId, int nextIndex, int total) {
    String message = String.format("Paused after segment %d of %d", nextIndex, total);
    TransitionResult paused =
        ledger.update(
            jobId, j -> j.transitionTo(JobStatus.PAUSED, message, clock.instant()));
    if (!paused.applied()) {
      LOGGER.info("Pause not applied, job {} changed: {}", jobId, paused.rejectionReason());
      if (paused.job().getStatus().isTerminal()) {
        cleanupTransientArtifacts(jobId);
      }
      return RunOutcome.CANCELLED;
    }
    structuredLogger.logStatusChange(jobId, "processing", "paused", message);
    return RunOutcome.PAUSED;
  }

  private RunOutcome complete(TranscriptionJob job, List<SegmentTranscript> results, int total) {
    String jobId = job.getId();

    String transcript = transcriptWriter.writeTranscript(results);
    if (transcript.isEmpty()) {
      return fail(jobId, NO_TEXT_MESSAGE);
    }

    String baseName = baseName(job.getOriginalFilename());
    ArtifactLocation transcriptLocation =
        artifactStore.put(
            ArtifactKind.TRANSCRIPT,
            jobId,
            baseName + ".txt",
            transcript.getBytes(StandardCharsets.UTF_8));

    ArtifactLocation subtitleLocation = null;
    if (!job.getConfig().skipSubtitle()) {
      String srt = transcriptWriter.writeSrt(results);
      if (srt.isEmpty()) {
        artifactStore.delete(transcriptLocation);
        return fail(jobId, "No subtitle content generated");
      }
      subtitleLocation =
          artifactStore.put(
              ArtifactKind.SUBTITLE,
              jobId,
              baseName + ".srt",
              srt.getBytes(StandardCharsets.UTF_8));
    }

    ArtifactLocation subtitle = subtitleLocation;
    TransitionResult completed =
        ledger.update(
            jobId,
            j -> {
              j.transitionTo(JobStatus.COMPLETED, "Transcription complete", clock.instant());
              j.advanceProgress(100);
              j.setCompletedSegments(total);
              j.setTranscriptLocation(transcriptLocation);
              j.setSubtitleLocation(subtitle);
              j.setInputLocation(null);
            });

    if (!completed.applied()) {
      LOGGER.info(
          "Completion not applied, job {} changed: {}", jobId, completed.rejectionReason());
      artifactStore.delete(transcriptLocation);
      if (subtitle != null) {
        artifactStore.delete(subtitle);
      }
      cleanupTransientArtifacts(jobId);
      return RunOutcome.CANCELLED;
    }

    structuredLogger.logStatusChange(jobId, "processing", "completed", "Transcription complete");
    cleanupTransientArtifacts(jobId);
    return RunOutcome.COMPLETED;
  }

  private String preflight(TranscriptionJob job) {
    if (job.getConfig().segmentLengthSeconds() <= 0) {
      return "Segment length must be positive: " + job.getConfig().segmentLengthSeconds();
    }
    if (job.getInputLocation() == null || !artifactStore.exists(job.getInputLocation())) {
      return "Input artifact is missing";
    }
    return null;
  }

  private DecodedAudio decodeInput(TranscriptionJob job, Path scratch) {
    if (job.getInputLocation() == null) {
      throw new IllegalArgumentException("Input artifact is missing");
    }
    byte[] input = artifactStore.get(job.getInputLocation());
    Path inputFile = scratch.resolve("input" + extension(job.getOriginalFilename()));
    try {
      Files.write(inputFile, input);
    } catch (IOException e) {
      throw new AudioDecodingException("Cannot stage input for decoding", e);
    }
    DecodedAudio audio = audioDecoder.decode(inputFile, scratch);
    LOGGER.info("Decoded input: jobId={}, duration={}s", job.getId(), audio.durationSeconds());
    return audio;
  }

  /**
   * Result of a segment finished in an earlier run. Falls back to transcribing again when the
   * chunk is gone; progress is not touched in that case.
   */
  private SegmentTranscript restoreSegment(
      TranscriptionJob job, DecodedAudio audio, Segment segment, Path scratch) {
    ArtifactLocation location = chunkLocation(job.getId(), segment.index());
    if (artifactStore.exists(location)) {
      try {
        return objectMapper.readValue(artifactStore.get(location), SegmentTranscript.class);
      } catch (IOException e) {
        LOGGER.warn("Unreadable chunk {}, transcribing segment again", location, e);
      }
    } else {
      LOGGER.warn("Missing chunk {}, transcribing segment again", location);
    }
    SegmentTranscript result = transcribeWithRetry(job, audio, segment, scratch);
    storeChunk(job.getId(), result);
    return result;
  }

  private SegmentTranscript transcribeWithRetry(
      TranscriptionJob job, DecodedAudio audio, Segment segment, Path scratch) {
    int maxAttempts = runnerProperties.segmentMaxAttempts();
    String model = job.getConfig().model();
    LanguageMode mode = LanguageMode.of(job.getConfig().keepSourceLanguage());

    structuredLogger.logSegmentStarted(
        segment.index(), segment.startSeconds(), segment.endSeconds());
    Path segmentFile =
        audioDecoder.extract(
            audio, segment, scratch.resolve(String.format("segment_%04d.wav", segment.index())));

    try {
      TranscriptionEngineException lastFailure = null;
      for (int attempt = 1; attempt <= maxAttempts; attempt++) {
        long startTime = System.currentTimeMillis();
        try {
          SegmentTranscript result =
              engine.transcribe(new SegmentAudio(segment, segmentFile), model, mode);
          structuredLogger.logSegmentFinished(
              segment.index(),
              segment.startSeconds(),
              segment.endSeconds(),
              System.currentTimeMillis() - startTime);
          return new SegmentTranscript(segment.index(), segment.startSeconds(), result.cues());

        } catch (TranscriptionEngineException e) {
          lastFailure = e;
          if (attempt < maxAttempts) {
            structuredLogger.logTranscribeRetry(
                segment.index(),
                attempt,
                maxAttempts,
                e.getClass().getSimpleName(),
                e.getMessage());
            backoff(attempt, segment.index(), e);
          }
        }
      }

      structuredLogger.logTranscribeFailed(
          segment.index(),
          maxAttempts,
          lastFailure.getClass().getSimpleName(),
          lastFailure.getMessage());
      throw new SegmentFailedException(segment.index(), maxAttempts, lastFailure);

    } finally {
      deleteFile(segmentFile);
    }
  }

  private void backoff(int attempt, int segmentIndex, TranscriptionEngineException failure) {
    Duration delay = runnerProperties.retryBackoff().multipliedBy(attempt);
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SegmentFailedException(segmentIndex, attempt, failure);
    }
  }

  private void storeChunk(String jobId, SegmentTranscript result) {
    try {
      artifactStore.put(
          ArtifactKind.CHUNK,
          jobId,
          chunkFilename(result.segmentIndex()),
          objectMapper.writeValueAsBytes(result));
    } catch (IOException e) {
      throw new ArtifactStoreException(
          "Cannot serialize result of segment " + result.segmentIndex(), e);
    }
  }

  private RunOutcome fail(String jobId, String reason) {
    JobStatus[] previous = new JobStatus[1];
    TransitionResult failed =
        ledger.update(
            jobId,
            j -> {
              previous[0] = j.getStatus();
              j.transitionTo(JobStatus.ERROR, reason, clock.instant());
            });
    cleanupTransientArtifacts(jobId);
    if (!failed.applied()) {
      LOGGER.info(
          "Failure not recorded, job {} already {}", jobId, failed.job().getStatus().wireName());
      return RunOutcome.CANCELLED;
    }
    structuredLogger.logStatusChange(jobId, previous[0].wireName(), "error", reason);
    return RunOutcome.FAILED;
  }

  /** Input and chunk artifacts are only needed while a job can still make progress. */
  private void cleanupTransientArtifacts(String jobId) {
    try {
      artifactStore.deleteAll(ArtifactKind.INPUT, jobId);
      artifactStore.deleteAll(ArtifactKind.CHUNK, jobId);
    } catch (ArtifactStoreException e) {
      LOGGER.warn("Could not clean up transient artifacts of job {}: {}", jobId, e.getMessage());
    }
  }

  static ArtifactLocation chunkLocation(String jobId, int segmentIndex) {
    return ArtifactLocation.of(ArtifactKind.CHUNK, jobId, chunkFilename(segmentIndex));
  }

  private static String chunkFilename(int segmentIndex) {
    return String.format("segment_%05d.json", segmentIndex);
  }

  static String baseName(String filename) {
    if (filename == null || filename.isBlank()) {
      return "transcript";
    }
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  private static String extension(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(dot) : "";
  }

  private static void deleteFile(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete segment file {}: {}", file, e.getMessage());
    }
  }

  private static void deleteRecursively(Path dir) {
    try (Stream<Path> walk = Files.walk(dir)) {
      walk.sorted(Comparator.reverseOrder()).forEach(JobRunner::deleteFile);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete scratch directory {}: {}", dir, e.getMessage());
    }
  }
}
