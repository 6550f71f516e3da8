package com.scholary.transcript.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactLocation;
import com.scholary.transcript.testutil.MutableClock;
import com.scholary.transcript.testutil.TestFixtures;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobLedgerTest {

  @TempDir Path tempDir;

  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

  private JobLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = newLedger(100);
  }

  @Test
  void create_shouldPersistQueuedJob() {
    TranscriptionJob job = create("a");

    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getCreatedAt()).isEqualTo(clock.instant());
    assertThat(newLedger(100).get("a").getStatus()).isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void create_shouldRejectDuplicateId() {
    create("a");

    assertThatThrownBy(() -> create("a")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void get_shouldThrowForUnknownJob() {
    assertThatThrownBy(() -> ledger.get("missing"))
        .isInstanceOf(JobNotFoundException.class)
        .hasMessageContaining("missing");
    assertThat(ledger.find("missing")).isEmpty();
  }

  @Test
  void get_shouldReturnCopiesThatDoNotLeakChanges() {
    create("a");

    ledger.get("a").setMessage("tampered");

    assertThat(ledger.get("a").getMessage()).isEqualTo("Queued");
  }

  @Test
  void update_shouldCommitAndStampUpdateTime() {
    create("a");
    clock.advance(Duration.ofSeconds(5));

    TransitionResult result =
        ledger.update("a", j -> j.transitionTo(JobStatus.PROCESSING, "go", clock.instant()));

    assertThat(result.applied()).isTrue();
    assertThat(result.job().getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(result.job().getUpdatedAt()).isEqualTo(clock.instant());
    assertThat(newLedger(100).get("a").getStatus()).isEqualTo(JobStatus.PROCESSING);
  }

  @Test
  void update_shouldLeaveJobUntouchedWhenTransitionIsIllegal() {
    create("a");

    TransitionResult result =
        ledger.update(
            "a",
            j -> {
              j.setMessage("half applied");
              j.transitionTo(JobStatus.COMPLETED, "done", clock.instant());
            });

    assertThat(result.applied()).isFalse();
    assertThat(result.rejectionReason()).isNotBlank();
    assertThat(result.job().getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(ledger.get("a").getMessage()).isEqualTo("Queued");
  }

  @Test
  void update_shouldNotWriteWhenMutationFails() {
    create("a");

    assertThatThrownBy(() -> ledger.update("a", j -> j.advanceProgress(200)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(ledger.get("a").getProgress()).isZero();
  }

  @Test
  void requestPause_shouldOnlyApplyWhileProcessing() {
    create("a");

    assertThat(ledger.requestPause("a").applied()).isFalse();

    ledger.update("a", j -> j.transitionTo(JobStatus.PROCESSING, "go", clock.instant()));
    TransitionResult first = ledger.requestPause("a");
    TransitionResult repeated = ledger.requestPause("a");

    assertThat(first.applied()).isTrue();
    assertThat(repeated.applied()).isTrue();
    TranscriptionJob job = ledger.get("a");
    assertThat(job.isPauseRequested()).isTrue();
    assertThat(job.isPaused()).isFalse();
    assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(job.getMessage()).isEqualTo("Pause requested");
  }

  @Test
  void requestResume_shouldOnlyApplyWhilePaused() {
    create("a");
    ledger.update("a", j -> j.transitionTo(JobStatus.PROCESSING, "go", clock.instant()));

    TransitionResult whileProcessing = ledger.requestResume("a");
    assertThat(whileProcessing.applied()).isFalse();
    assertThat(whileProcessing.job().getStatus()).isEqualTo(JobStatus.PROCESSING);

    ledger.update("a", j -> j.transitionTo(JobStatus.PAUSED, "Paused", clock.instant()));
    TransitionResult resumed = ledger.requestResume("a");
    TransitionResult again = ledger.requestResume("a");

    assertThat(resumed.applied()).isTrue();
    assertThat(resumed.job().getStatus()).isEqualTo(JobStatus.PROCESSING);
    assertThat(resumed.job().getMessage()).isEqualTo("Resuming");
    assertThat(again.applied()).isFalse();
  }

  @Test
  void list_shouldIncludeJobsEvictedFromCache() {
    JobLedger small = newLedger(1);
    for (String id : new String[] {"a", "b", "c"}) {
      small.create(id, TestFixtures.config(30), "x.mp3", input(id));
    }

    assertThat(small.list())
        .extracting(TranscriptionJob::getId)
        .containsExactlyInAnyOrder("a", "b", "c");
    assertThat(small.get("a").getStatus()).isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void remove_shouldForgetJob() {
    create("a");

    ledger.remove("a");
    ledger.remove("a");

    assertThat(ledger.find("a")).isEmpty();
    assertThat(newLedger(100).find("a")).isEmpty();
  }

  private TranscriptionJob create(String id) {
    return ledger.create(id, TestFixtures.config(30), "x.mp3", input(id));
  }

  private static ArtifactLocation input(String id) {
    return ArtifactLocation.of(ArtifactKind.INPUT, id, "x.mp3");
  }

  private JobLedger newLedger(int maxSize) {
    return new JobLedger(
        new FileJobSnapshotStore(tempDir, TestFixtures.objectMapper()),
        new JobStoreProperties(maxSize),
        clock);
  }
}
