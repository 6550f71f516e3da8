package com.scholary.transcript.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in MDC for the duration of one log call, so they can be queried
 * in a log search backend. The job id is set once per run with {@link #setJobContext}.
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "segment_index",
    "start",
    "end",
    "transcribeMs",
    "attempt",
    "maxAttempts",
    "errorType",
    "segmentsCompleted",
    "segmentsTotal",
    "percentComplete",
    "fromStatus",
    "toStatus"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log segment started event. */
  public void logSegmentStarted(int segmentIndex, double start, double end) {
    try {
      MDC.put("event_type", "segment_started");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));

      logger.debug("Segment started: index={}, range=[{}-{}]", segmentIndex, start, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment finished event. */
  public void logSegmentFinished(int segmentIndex, double start, double end, long transcribeMs) {
    try {
      MDC.put("event_type", "segment_finished");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.debug(
          "Segment finished: index={}, range=[{}-{}], transcribe={}ms",
          segmentIndex,
          start,
          end,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(
      int segmentIndex, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Transcribe retry: segment={}, attempt={}/{}, error={}, message={}",
          segmentIndex,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(
      int segmentIndex, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Transcribe failed: segment={}, attempts={}, error={}, message={}",
          segmentIndex,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int segmentsCompleted, int segmentsTotal, int percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("segmentsCompleted", String.valueOf(segmentsCompleted));
      MDC.put("segmentsTotal", String.valueOf(segmentsTotal));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Job progress: jobId={}, segments={}/{}, progress={}%",
          jobId,
          segmentsCompleted,
          segmentsTotal,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log job status change event. */
  public void logStatusChange(String jobId, String fromStatus, String toStatus, String message) {
    try {
      MDC.put("event_type", "job_status");
      MDC.put("fromStatus", fromStatus);
      MDC.put("toStatus", toStatus);

      logger.info(
          "Job status: jobId={}, {} -> {}, message={}", jobId, fromStatus, toStatus, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
