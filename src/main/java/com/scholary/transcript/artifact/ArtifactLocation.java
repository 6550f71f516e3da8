package com.scholary.transcript.artifact;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * Backend-neutral address of an artifact: {@code <kind prefix>/<jobId>/<filename>}.
 *
 * <p>The same key is a relative path for the local store and an object key for S3. Serialized
 * as a plain string in job snapshots.
 */
public record ArtifactLocation(String key) {

  public ArtifactLocation {
    Objects.requireNonNull(key, "key");
    if (key.isBlank() || key.startsWith("/") || key.contains("..")) {
      throw new IllegalArgumentException("Invalid artifact key: " + key);
    }
  }

  public static ArtifactLocation of(ArtifactKind kind, String jobId, String filename) {
    return new ArtifactLocation(jobPrefix(kind, jobId) + filename);
  }

  /** Key prefix shared by every artifact of one kind for one job. */
  public static String jobPrefix(ArtifactKind kind, String jobId) {
    return kind.prefix() + "/" + jobId + "/";
  }

  @JsonCreator
  public static ArtifactLocation fromKey(String key) {
    return new ArtifactLocation(key);
  }

  @JsonValue
  @Override
  public String key() {
    return key;
  }

  /** Last path element of the key. */
  public String filename() {
    return key.substring(key.lastIndexOf('/') + 1);
  }

  @Override
  public String toString() {
    return key;
  }
}
