package com.scholary.transcript.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactLocation;
import com.scholary.transcript.artifact.LocalArtifactStore;
import com.scholary.transcript.dispatch.JobDispatcher;
import com.scholary.transcript.job.FileJobSnapshotStore;
import com.scholary.transcript.job.IllegalTransitionException;
import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobNotFoundException;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.JobStoreProperties;
import com.scholary.transcript.job.TranscriptionJob;
import com.scholary.transcript.testutil.MutableClock;
import com.scholary.transcript.testutil.TestFixtures;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionJobServiceTest {

  private static final byte[] AUDIO = "ID3-fake-audio".getBytes(StandardCharsets.UTF_8);

  @Mock private JobDispatcher dispatcher;

  @TempDir Path tempDir;

  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

  private JobLedger ledger;
  private LocalArtifactStore artifactStore;
  private TranscriptionJobService service;

  @BeforeEach
  void setUp() {
    ledger =
        new JobLedger(
            new FileJobSnapshotStore(tempDir.resolve("jobs"), TestFixtures.objectMapper()),
            new JobStoreProperties(10),
            clock);
    artifactStore = new LocalArtifactStore(tempDir.resolve("artifacts"));
    service =
        new TranscriptionJobService(
            ledger,
            artifactStore,
            dispatcher,
            TestFixtures.transcriptionProperties(tempDir),
            clock);
  }

  @Test
  void submit_shouldStoreInputCreateQueuedJobAndDispatch() {
    TranscriptionJob job = service.submit(defaults(), "My Talk.mp3", AUDIO);

    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getConfig().model()).isEqualTo("medium");
    assertThat(job.getConfig().segmentLengthSeconds()).isEqualTo(60);
    assertThat(job.getConfig().keepSourceLanguage()).isFalse();
    assertThat(job.getOriginalFilename()).isEqualTo("My Talk.mp3");
    assertThat(artifactStore.get(job.getInputLocation())).isEqualTo(AUDIO);
    assertThat(ledger.get(job.getId()).getStatus()).isEqualTo(JobStatus.QUEUED);
    verify(dispatcher).dispatch(job.getId());
  }

  @Test
  void submit_shouldHonorClientSettings() {
    TranscriptionJob job =
        service.submit(new JobSubmission(" large-v3 ", true, true, 30), "a.wav", AUDIO);

    assertThat(job.getConfig().model()).isEqualTo("large-v3");
    assertThat(job.getConfig().keepSourceLanguage()).isTrue();
    assertThat(job.getConfig().skipSubtitle()).isTrue();
    assertThat(job.getConfig().segmentLengthSeconds()).isEqualTo(30);
  }

  @Test
  void submit_shouldRejectEmptyUpload() {
    assertThatThrownBy(() -> service.submit(defaults(), "a.mp3", new byte[0]))
        .isInstanceOf(JobValidationException.class)
        .hasMessage("Uploaded file is empty");
    verify(dispatcher, never()).dispatch(anyString());
    assertThat(ledger.list()).isEmpty();
  }

  @Test
  void submit_shouldRejectUnsupportedModel() {
    assertThatThrownBy(
            () -> service.submit(new JobSubmission("huge", false, false, null), "a.mp3", AUDIO))
        .isInstanceOf(JobValidationException.class)
        .hasMessageStartingWith("Unsupported model: huge. Choose one of tiny, base");
  }

  @Test
  void submit_shouldRejectNonPositiveSegmentLength() {
    assertThatThrownBy(
            () -> service.submit(new JobSubmission(null, false, false, 0), "a.mp3", AUDIO))
        .isInstanceOf(JobValidationException.class)
        .hasMessageContaining("Segment length must be positive");
  }

  @Test
  void sanitizeFilename_shouldKeepOnlySafeLastPathElement() {
    assertThat(TranscriptionJobService.sanitizeFilename("C:\\rec\\day 1.mp3"))
        .isEqualTo("day 1.mp3");
    assertThat(TranscriptionJobService.sanitizeFilename("../../etc/passwd")).isEqualTo("passwd");
    assertThat(TranscriptionJobService.sanitizeFilename("a..b?.mp3")).isEqualTo("a.b_.mp3");
    assertThatThrownBy(() -> TranscriptionJobService.sanitizeFilename(".."))
        .isInstanceOf(JobValidationException.class);
    assertThatThrownBy(() -> TranscriptionJobService.sanitizeFilename(null))
        .isInstanceOf(JobValidationException.class);
  }

  @Test
  void status_shouldThrowForUnknownJob() {
    assertThatThrownBy(() -> service.status("missing")).isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void pause_shouldBeRejectedUnlessProcessing() {
    TranscriptionJob job = service.submit(defaults(), "a.mp3", AUDIO);

    IllegalTransitionException e =
        catchThrowableOfType(() -> service.pause(job.getId()), IllegalTransitionException.class);

    assertThat(e.getCurrentStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(service.status(job.getId()).getStatus()).isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void pause_shouldRecordRequestWithoutReportingPaused() {
    TranscriptionJob job = processingJob();

    TranscriptionJob paused = service.pause(job.getId());

    assertThat(paused.getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(paused.isPauseRequested()).isTrue();
    assertThat(paused.isPaused()).isFalse();
  }

  @Test
  void resume_shouldMovePausedJobToProcessingAndDispatch() {
    TranscriptionJob job = processingJob();
    ledger.update(job.getId(), j -> j.transitionTo(JobStatus.PAUSED, "Paused", clock.instant()));

    TranscriptionJob resumed = service.resume(job.getId());

    assertThat(resumed.getStatus()).isEqualTo(JobStatus.PROCESSING);
    verify(dispatcher, times(2)).dispatch(job.getId());
  }

  @Test
  void resume_shouldApplyExactlyOneOfTwoConcurrentRequests() throws Exception {
    TranscriptionJob job = processingJob();
    ledger.update(job.getId(), j -> j.transitionTo(JobStatus.PAUSED, "Paused", clock.instant()));
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger applied = new AtomicInteger();
    List<JobStatus> rejectedWith = new CopyOnWriteArrayList<>();
    Callable<Void> resume =
        () -> {
          start.await();
          try {
            service.resume(job.getId());
            applied.incrementAndGet();
          } catch (IllegalTransitionException e) {
            rejectedWith.add(e.getCurrentStatus());
          }
          return null;
        };

    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<Void> first = pool.submit(resume);
      Future<Void> second = pool.submit(resume);
      start.countDown();
      first.get(10, TimeUnit.SECONDS);
      second.get(10, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    assertThat(applied.get()).isEqualTo(1);
    assertThat(rejectedWith).containsExactly(JobStatus.PROCESSING);
    assertThat(ledger.get(job.getId()).getStatus()).isEqualTo(JobStatus.PROCESSING);
    // once on submit, once for the applied resume
    verify(dispatcher, times(2)).dispatch(job.getId());
  }

  @Test
  void resume_shouldBeRejectedWhileProcessing() {
    TranscriptionJob job = processingJob();

    IllegalTransitionException e =
        catchThrowableOfType(() -> service.resume(job.getId()), IllegalTransitionException.class);

    assertThat(e.getCurrentStatus()).isEqualTo(JobStatus.PROCESSING);
  }

  @Test
  void cancel_shouldFailJobAndRemoveInputWhenNoRunnerIsActive() {
    TranscriptionJob job = processingJob();
    when(dispatcher.isActive(job.getId())).thenReturn(false);

    TranscriptionJob cancelled = service.cancel(job.getId());

    assertThat(cancelled.getStatus()).isEqualTo(JobStatus.ERROR);
    assertThat(cancelled.getMessage()).isEqualTo(TranscriptionJobService.CANCELLED_MESSAGE);
    assertThat(artifactStore.exists(job.getInputLocation())).isFalse();
  }

  @Test
  void cancel_shouldLeaveCleanupToActiveRunner() {
    TranscriptionJob job = processingJob();
    when(dispatcher.isActive(job.getId())).thenReturn(true);

    service.cancel(job.getId());

    assertThat(artifactStore.exists(job.getInputLocation())).isTrue();
  }

  @Test
  void cancel_shouldBeRejectedForFinishedJobs() {
    TranscriptionJob job = completedJob(true);

    assertThatThrownBy(() -> service.cancel(job.getId()))
        .isInstanceOf(IllegalTransitionException.class);
    assertThat(service.status(job.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
  }

  @Test
  void fetchOutput_shouldFailUntilJobIsCompleted() {
    TranscriptionJob job = processingJob();

    assertThatThrownBy(() -> service.fetchOutput(job.getId(), null))
        .isInstanceOf(OutputNotAvailableException.class)
        .hasMessageContaining("status processing");
  }

  @Test
  void fetchOutput_shouldDefaultToSubtitleAndRecordFirstRetrieval() {
    TranscriptionJob job = completedJob(true);

    JobOutput output = service.fetchOutput(job.getId(), null);
    Instant firstRetrieval = clock.instant();
    clock.advance(Duration.ofMinutes(3));
    service.fetchOutput(job.getId(), OutputKind.TRANSCRIPT);

    assertThat(output.filename()).isEqualTo("a.srt");
    assertThat(output.contentType()).startsWith("application/x-subrip");
    assertThat(new String(output.content(), StandardCharsets.UTF_8)).startsWith("1\n");
    assertThat(ledger.get(job.getId()).getOutputRetrievedAt()).isEqualTo(firstRetrieval);
  }

  @Test
  void fetchOutput_shouldServeTranscriptWhenSubtitleWasSkipped() {
    TranscriptionJob job = completedJob(false);

    JobOutput output = service.fetchOutput(job.getId(), null);

    assertThat(output.filename()).isEqualTo("a.txt");
    assertThat(new String(output.content(), StandardCharsets.UTF_8)).isEqualTo("hello");
    assertThatThrownBy(() -> service.fetchOutput(job.getId(), OutputKind.SUBTITLE))
        .isInstanceOf(OutputNotAvailableException.class);
  }

  @Test
  void outputKind_shouldParseRequestParameter() {
    assertThat(OutputKind.fromParam(" Subtitle ")).isEqualTo(OutputKind.SUBTITLE);
    assertThat(OutputKind.fromParam("")).isNull();
    assertThatThrownBy(() -> OutputKind.fromParam("json"))
        .isInstanceOf(JobValidationException.class);
  }

  private static JobSubmission defaults() {
    return new JobSubmission(null, false, false, null);
  }

  private TranscriptionJob processingJob() {
    TranscriptionJob job = service.submit(defaults(), "a.mp3", AUDIO);
    return ledger
        .update(
            job.getId(),
            j -> j.transitionTo(JobStatus.PROCESSING, "Preparing audio", clock.instant()))
        .job();
  }

  private TranscriptionJob completedJob(boolean withSubtitle) {
    TranscriptionJob job = processingJob();
    String id = job.getId();
    ArtifactLocation transcript =
        artifactStore.put(ArtifactKind.TRANSCRIPT, id, "a.txt", bytes("hello"));
    String srt = "1\n00:00:00,000 --> 00:00:01,000\nhello\n";
    ArtifactLocation subtitle =
        withSubtitle ? artifactStore.put(ArtifactKind.SUBTITLE, id, "a.srt", bytes(srt)) : null;
    return ledger
        .update(
            id,
            j -> {
              j.transitionTo(JobStatus.COMPLETED, "Transcription complete", clock.instant());
              j.setTranscriptLocation(transcript);
              j.setSubtitleLocation(subtitle);
            })
        .job();
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
