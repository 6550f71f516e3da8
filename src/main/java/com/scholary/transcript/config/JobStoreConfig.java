package com.scholary.transcript.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcript.job.FileJobSnapshotStore;
import com.scholary.transcript.job.JobLedger;
import com.scholary.transcript.job.JobSnapshotStore;
import com.scholary.transcript.job.JobStoreProperties;
import java.nio.file.Paths;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the job ledger.
 *
 * <p>Job snapshots are kept as JSON files under {@code <workDir>/jobs}.
 */
@Configuration
@EnableConfigurationProperties(JobStoreProperties.class)
public class JobStoreConfig {

  @Bean
  public JobSnapshotStore jobSnapshotStore(
      TranscriptionProperties properties, ObjectMapper objectMapper) {
    return new FileJobSnapshotStore(Paths.get(properties.workDir()).resolve("jobs"), objectMapper);
  }

  @Bean
  public JobLedger jobLedger(
      JobSnapshotStore jobSnapshotStore, JobStoreProperties properties, Clock clock) {
    return new JobLedger(jobSnapshotStore, properties, clock);
  }
}
