package com.scholary.transcript.service;

import java.util.Locale;

/** Which output of a completed job to download. */
public enum OutputKind {
  SUBTITLE,
  TRANSCRIPT;

  /**
   * Parse a request parameter such as {@code subtitle}.
   *
   * @return the kind, or {@code null} for a blank value
   * @throws JobValidationException for an unknown value
   */
  public static OutputKind fromParam(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new JobValidationException(
          "Unknown output kind: " + value + ". Use subtitle or transcript");
    }
  }
}
