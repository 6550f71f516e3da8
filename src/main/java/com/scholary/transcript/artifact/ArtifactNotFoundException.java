package com.scholary.transcript.artifact;

/** Thrown when an artifact is requested that does not exist (never stored, or purged). */
public class ArtifactNotFoundException extends RuntimeException {

  private final transient ArtifactLocation location;

  public ArtifactNotFoundException(ArtifactLocation location) {
    super("Artifact not found: " + location);
    this.location = location;
  }

  public ArtifactNotFoundException(ArtifactLocation location, Throwable cause) {
    super("Artifact not found: " + location, cause);
    this.location = location;
  }

  public ArtifactLocation getLocation() {
    return location;
  }
}
