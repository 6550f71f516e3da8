package com.scholary.transcript.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.scholary.transcript.artifact.ArtifactKind;
import com.scholary.transcript.artifact.ArtifactLocation;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TranscriptionJobTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private TranscriptionJob job;

  @BeforeEach
  void setUp() {
    job =
        new TranscriptionJob(
            "j1",
            new JobConfig("medium", false, false, 60),
            "a.mp3",
            ArtifactLocation.of(ArtifactKind.INPUT, "j1", "a.mp3"),
            NOW);
  }

  @Test
  void newJob_shouldBeQueuedWithZeroProgress() {
    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getMessage()).isEqualTo("Queued");
    assertThat(job.isPaused()).isFalse();
    assertThat(job.isOutputReady()).isFalse();
  }

  @Test
  void transitionTo_shouldRejectIllegalMoves() {
    IllegalTransitionException e =
        catchThrowableOfType(
            () -> job.transitionTo(JobStatus.COMPLETED, "done", NOW),
            IllegalTransitionException.class);

    assertThat(e.getCurrentStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
  }

  @Test
  void transitionTo_shouldClearPendingPauseWhenLeavingProcessing() {
    job.transitionTo(JobStatus.PROCESSING, "Preparing audio", NOW);
    job.setPauseRequested(true);

    job.transitionTo(JobStatus.PAUSED, "Paused", NOW);

    assertThat(job.isPauseRequested()).isFalse();
    assertThat(job.isPaused()).isTrue();
    assertThat(job.getFinishedAt()).isNull();
  }

  @Test
  void transitionTo_shouldStampFinishTimeOnTerminalStates() {
    Instant later = NOW.plusSeconds(30);
    job.transitionTo(JobStatus.ERROR, "boom", later);

    assertThat(job.getFinishedAt()).isEqualTo(later);
    assertThat(job.getMessage()).isEqualTo("boom");
  }

  @Test
  void advanceProgress_shouldNeverDecrease() {
    job.advanceProgress(40);

    assertThatThrownBy(() -> job.advanceProgress(39)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> job.advanceProgress(101))
        .isInstanceOf(IllegalArgumentException.class);
    job.advanceProgress(40);
    assertThat(job.getProgress()).isEqualTo(40);
  }

  @Test
  void copy_shouldBeIndependent() {
    TranscriptionJob copy = job.copy();
    copy.setMessage("changed");
    copy.advanceProgress(10);

    assertThat(job.getMessage()).isEqualTo("Queued");
    assertThat(job.getProgress()).isZero();
    assertThat(copy.getId()).isEqualTo("j1");
  }
}
