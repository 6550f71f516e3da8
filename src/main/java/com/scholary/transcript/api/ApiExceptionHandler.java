package com.scholary.transcript.api;

import com.scholary.transcript.artifact.ArtifactNotFoundException;
import com.scholary.transcript.job.IllegalTransitionException;
import com.scholary.transcript.job.JobNotFoundException;
import com.scholary.transcript.service.JobValidationException;
import com.scholary.transcript.service.OutputNotAvailableException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Maps job errors to HTTP responses with an {@link ApiError} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private final Clock clock;

  public ApiExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  @ExceptionHandler(JobValidationException.class)
  public ResponseEntity<ApiError> handleValidation(JobValidationException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception ex) {
    LOGGER.warn("Incomplete request: {}", ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxSize(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Upload too large: {}", ex.getMessage());
    return build(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file exceeds the size limit", null);
  }

  @ExceptionHandler({
    JobNotFoundException.class,
    ArtifactNotFoundException.class,
    OutputNotAvailableException.class
  })
  public ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
    LOGGER.debug("Not found: {}", ex.getMessage());
    return build(HttpStatus.NOT_FOUND, ex.getMessage(), null);
  }

  @ExceptionHandler(IllegalTransitionException.class)
  public ResponseEntity<ApiError> handleIllegalTransition(IllegalTransitionException ex) {
    LOGGER.info("Rejected transition: {}", ex.getMessage());
    return build(HttpStatus.CONFLICT, ex.getMessage(), ex.getCurrentStatus().wireName());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiError> handleUnexpected(RuntimeException ex) {
    LOGGER.error("Unexpected error", ex);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", null);
  }

  private ResponseEntity<ApiError> build(HttpStatus status, String message, String currentStatus) {
    ApiError body =
        new ApiError(
            clock.instant(), status.value(), status.getReasonPhrase(), message, currentStatus);
    return ResponseEntity.status(status).body(body);
  }
}
