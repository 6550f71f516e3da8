package com.scholary.transcript.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.scholary.transcript.config.TranscriptionProperties;
import com.scholary.transcript.job.JobConfig;
import com.scholary.transcript.runner.RunnerProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/** Shared builders for unit tests. */
public final class TestFixtures {

  public static final List<String> MODELS =
      List.of("tiny", "base", "small", "medium", "large", "large-v2", "large-v3");

  private TestFixtures() {}

  public static ObjectMapper objectMapper() {
    return JsonMapper.builder().findAndAddModules().build();
  }

  public static TranscriptionProperties transcriptionProperties(Path workDir) {
    return new TranscriptionProperties(workDir.toString(), 60, "medium", MODELS, 2, 10);
  }

  /** Retries without waiting between attempts. */
  public static RunnerProperties runnerProperties(int maxAttempts) {
    return new RunnerProperties(maxAttempts, Duration.ZERO);
  }

  public static JobConfig config(int segmentLengthSeconds) {
    return new JobConfig("medium", false, false, segmentLengthSeconds);
  }
}
