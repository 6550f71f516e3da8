package com.scholary.transcript.artifact;

/**
 * Kinds of artifact a job owns, each with its own key prefix.
 *
 * <p>INPUT and CHUNK artifacts are deleted when the job reaches a terminal state. TRANSCRIPT and
 * SUBTITLE artifacts live until the retention sweeper purges them.
 */
public enum ArtifactKind {
  INPUT("uploads", "application/octet-stream"),
  CHUNK("chunks", "application/json"),
  TRANSCRIPT("outputs/transcripts", "text/plain; charset=utf-8"),
  SUBTITLE("outputs/subtitles", "application/x-subrip; charset=utf-8");

  private final String prefix;
  private final String contentType;

  ArtifactKind(String prefix, String contentType) {
    this.prefix = prefix;
    this.contentType = contentType;
  }

  public String prefix() {
    return prefix;
  }

  public String contentType() {
    return contentType;
  }
}
