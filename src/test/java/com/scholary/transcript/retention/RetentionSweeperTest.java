package com.scholary.transcript.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactLocation;
import com.scholary.transcript.artifact.ArtifactStore;
import com.scholary.transcript.artifact.ArtifactStoreException;
import com.scholary.transcript.artifact.LocalArtifactStore;
import com.scholary.transcript.job.FileJobSnapshotStore;
import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobStatus;
import com.scholary.transcript.job.JobStoreProperties;
import com.scholary.transcript.testutil.MutableClock;
import com.scholary.transcript.testutil.TestFixtures;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RetentionSweeperTest {

  private static final Duration GRACE = Duration.ofMinutes(10);
  private static final Duration RETENTION = Duration.ofHours(24);

  @TempDir Path tempDir;

  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

  private JobLedger ledger;
  private LocalArtifactStore artifactStore;

  @BeforeEach
  void setUp() {
    ledger =
        new JobLedger(
            new FileJobSnapshotStore(tempDir.resolve("jobs"), TestFixtures.objectMapper()),
            new JobStoreProperties(10),
            clock);
    artifactStore = new LocalArtifactStore(tempDir.resolve("artifacts"));
  }

  @Test
  void sweep_shouldPurgeRetrievedOutputAfterGracePeriod() {
    RetentionSweeper sweeper = sweeper(RetentionPolicy.AFTER_RETRIEVAL, artifactStore);
    ArtifactLocation transcript = completedJob("a");
    ledger.update("a", j -> j.setOutputRetrievedAt(clock.instant()));

    clock.advance(GRACE.minusSeconds(1));
    assertThat(sweeper.sweep()).isZero();
    assertThat(ledger.find("a")).isPresent();

    clock.advance(Duration.ofSeconds(1));
    assertThat(sweeper.sweep()).isEqualTo(1);
    assertThat(ledger.find("a")).isEmpty();
    assertThat(artifactStore.exists(transcript)).isFalse();
  }

  @Test
  void sweep_shouldKeepUnretrievedOutputUntilRetentionEnds() {
    RetentionSweeper sweeper = sweeper(RetentionPolicy.AFTER_RETRIEVAL, artifactStore);
    completedJob("a");

    clock.advance(RETENTION.minusMinutes(1));
    assertThat(sweeper.sweep()).isZero();

    clock.advance(Duration.ofMinutes(1));
    assertThat(sweeper.sweep()).isEqualTo(1);
    assertThat(ledger.find("a")).isEmpty();
  }

  @Test
  void sweep_shouldIgnoreRetrievalUnderRetentionTimeoutPolicy() {
    RetentionSweeper sweeper = sweeper(RetentionPolicy.RETENTION_TIMEOUT, artifactStore);
    completedJob("a");
    ledger.update("a", j -> j.setOutputRetrievedAt(clock.instant()));

    clock.advance(GRACE.plusMinutes(1));

    assertThat(sweeper.sweep()).isZero();
    assertThat(ledger.find("a")).isPresent();
  }

  @Test
  void sweep_shouldPurgeFailedJobsAfterRetention() {
    RetentionSweeper sweeper = sweeper(RetentionPolicy.AFTER_RETRIEVAL, artifactStore);
    queuedJob("a");
    ledger.update("a", j -> j.transitionTo(JobStatus.ERROR, "boom", clock.instant()));

    clock.advance(RETENTION);

    assertThat(sweeper.sweep()).isEqualTo(1);
    assertThat(ledger.find("a")).isEmpty();
  }

  @Test
  void sweep_shouldNeverTouchUnfinishedJobs() {
    RetentionSweeper sweeper = sweeper(RetentionPolicy.RETENTION_TIMEOUT, artifactStore);
    queuedJob("queued");
    queuedJob("paused");
    ledger.update("paused", j -> j.transitionTo(JobStatus.PROCESSING, "go", clock.instant()));
    ledger.update("paused", j -> j.transitionTo(JobStatus.PAUSED, "Paused", clock.instant()));

    clock.advance(Duration.ofDays(30));

    assertThat(sweeper.sweep()).isZero();
    assertThat(ledger.list()).hasSize(2);
  }

  @Test
  void sweep_shouldKeepJobWhenArtifactsCannotBeDeleted() {
    ArtifactStore failingStore = mock(ArtifactStore.class);
    when(failingStore.deleteAll(any(ArtifactKind.class), anyString()))
        .thenThrow(new ArtifactStoreException("bucket unavailable"));
    RetentionSweeper sweeper = sweeper(RetentionPolicy.AFTER_RETRIEVAL, failingStore);
    queuedJob("a");
    ledger.update("a", j -> j.transitionTo(JobStatus.ERROR, "boom", clock.instant()));
    clock.advance(RETENTION);

    assertThat(sweeper.sweep()).isZero();
    assertThat(ledger.find("a")).isPresent();
  }

  @Test
  void expiry_shouldBeNullForUnfinishedJobs() {
    RetentionSweeper sweeper = sweeper(RetentionPolicy.AFTER_RETRIEVAL, artifactStore);
    queuedJob("a");

    assertThat(sweeper.expiry(ledger.get("a"))).isNull();
  }

  private RetentionSweeper sweeper(RetentionPolicy policy, ArtifactStore store) {
    return new RetentionSweeper(
        ledger,
        store,
        new RetentionProperties(policy, GRACE, RETENTION, Duration.ofMinutes(5)),
        clock);
  }

  private void queuedJob(String id) {
    ArtifactLocation input =
        artifactStore.put(ArtifactKind.INPUT, id, "a.mp3", new byte[] {1});
    ledger.create(id, TestFixtures.config(30), "a.mp3", input);
  }

  private ArtifactLocation completedJob(String id) {
    queuedJob(id);
    ArtifactLocation transcript =
        artifactStore.put(
            ArtifactKind.TRANSCRIPT, id, "a.txt", "text".getBytes(StandardCharsets.UTF_8));
    ledger.update(id, j -> j.transitionTo(JobStatus.PROCESSING, "go", clock.instant()));
    ledger.update(
        id,
        j -> {
          j.transitionTo(JobStatus.COMPLETED, "Transcription complete", clock.instant());
          j.setTranscriptLocation(transcript);
          j.setInputLocation(null);
        });
    return transcript;
  }
}
