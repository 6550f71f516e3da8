package com.scholary.transcript.config;

import com.scholary.transcript.decode.FfmpegProperties;
import com.scholary.transcript.engine.WhisperProperties;
import com.scholary.transcript.retention.RetentionProperties;
import com.scholary.transcript.runner.RunnerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcription-related beans.
 *
 * <p>Enables the properties records of the runner and its collaborators to be loaded from
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  TranscriptionProperties.class,
  RunnerProperties.class,
  RetentionProperties.class,
  WhisperProperties.class,
  FfmpegProperties.class
})
public class TranscriptionConfig {}
