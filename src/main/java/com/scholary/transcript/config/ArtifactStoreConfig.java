package com.scholary.transcript.config;

import com.scholary.transcript.artifact.ArtifactStore;
import com.scholary.transcript.artifact.LocalArtifactStore;
import com.scholary.transcript.artifact.ObjectStoreProperties;
import com.scholary.transcript.artifact.S3ArtifactStore;
import java.net.URI;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Configuration for artifact storage.
 *
 * <p>{@code artifacts.backend=local} (the default) keeps artifacts under {@code
 * <workDir>/artifacts}; {@code artifacts.backend=s3} stores them in an S3 or MinIO bucket
 * configured through {@code objectstore.*}.
 */
@Configuration
public class ArtifactStoreConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactStoreConfig.class);

  @Configuration
  @ConditionalOnProperty(name = "artifacts.backend", havingValue = "local", matchIfMissing = true)
  static class LocalBackend {

    @Bean
    public ArtifactStore artifactStore(TranscriptionProperties properties) {
      return new LocalArtifactStore(Paths.get(properties.workDir()).resolve("artifacts"));
    }
  }

  @Configuration
  @ConditionalOnProperty(name = "artifacts.backend", havingValue = "s3")
  @EnableConfigurationProperties(ObjectStoreProperties.class)
  static class S3Backend {

    @Bean
    public S3Client s3Client(ObjectStoreProperties properties) {
      LOGGER.info(
          "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
          properties.endpoint(),
          properties.bucket(),
          properties.pathStyleAccess());

      AwsBasicCredentials credentials =
          AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

      Region region =
          properties.region() != null && !properties.region().isEmpty()
              ? Region.of(properties.region())
              : Region.US_EAST_1;

      return S3Client.builder()
          .region(region)
          .credentialsProvider(StaticCredentialsProvider.create(credentials))
          .endpointOverride(URI.create(properties.endpoint()))
          .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
          .build();
    }

    @Bean
    public ArtifactStore artifactStore(S3Client s3Client, ObjectStoreProperties properties) {
      return new S3ArtifactStore(s3Client, properties.bucket());
    }
  }
}
