package com.scholary.transcript.api;

import com.scholary.transcript.service.JobOutput;
import com.scholary.transcript.service.JobSubmission;
import com.scholary.transcript.service.OutputKind;
import com.scholary.transcript.service.TranscriptionJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for transcription jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading media (returns the queued job immediately)
 *   <li>Status polling
 *   <li>Pause, resume and operator cancel
 *   <li>Downloading the transcript or subtitle
 * </ul>
 *
 * <p>Clients may disconnect at any time and poll again later with the job id.
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Transcription jobs", description = "Pausable, resumable transcription jobs")
public class TranscriptionJobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobController.class);

  private final TranscriptionJobService jobService;

  public TranscriptionJobController(TranscriptionJobService jobService) {
    this.jobService = jobService;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Submit media",
      description = "Upload an audio or video file and start a transcription job")
  public ResponseEntity<JobStatusResponse> submit(
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "model", required = false) String model,
      @RequestParam(value = "keepSourceLanguage", defaultValue = "false")
          boolean keepSourceLanguage,
      @RequestParam(value = "skipSubtitle", defaultValue = "false") boolean skipSubtitle,
      @RequestParam(value = "segmentLengthSeconds", required = false)
          Integer segmentLengthSeconds)
      throws IOException {
    LOGGER.info(
        "Submission: file={}, size={}, model={}",
        file.getOriginalFilename(),
        file.getSize(),
        model);

    JobSubmission submission =
        new JobSubmission(model, keepSourceLanguage, skipSubtitle, segmentLengthSeconds);
    JobStatusResponse response =
        JobStatusResponse.from(
            jobService.submit(submission, file.getOriginalFilename(), file.getBytes()));
    return ResponseEntity.accepted().body(response);
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get job status", description = "Current status and progress of a job")
  public JobStatusResponse status(@PathVariable String id) {
    return JobStatusResponse.from(jobService.status(id));
  }

  @PostMapping("/{id}/pause")
  @Operation(
      summary = "Pause job",
      description = "Stop a processing job after its current segment; 409 if not processing")
  public JobStatusResponse pause(@PathVariable String id) {
    return JobStatusResponse.from(jobService.pause(id));
  }

  @PostMapping("/{id}/resume")
  @Operation(
      summary = "Resume job",
      description = "Continue a paused job from its last completed segment; 409 if not paused")
  public JobStatusResponse resume(@PathVariable String id) {
    return JobStatusResponse.from(jobService.resume(id));
  }

  @PostMapping("/{id}/cancel")
  @Operation(summary = "Cancel job", description = "Operator cancel; the job ends in error")
  public JobStatusResponse cancel(@PathVariable String id) {
    return JobStatusResponse.from(jobService.cancel(id));
  }

  @GetMapping("/{id}/output")
  @Operation(
      summary = "Download output",
      description = "Subtitle (default when produced) or transcript of a completed job")
  public ResponseEntity<byte[]> output(
      @PathVariable String id, @RequestParam(value = "kind", required = false) String kind) {
    JobOutput output = jobService.fetchOutput(id, OutputKind.fromParam(kind));
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(output.filename()).build().toString())
        .contentType(MediaType.parseMediaType(output.contentType()))
        .body(output.content());
  }
}
