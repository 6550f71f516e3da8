package com.scholary.transcript.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a faster-whisper transcription service.
 *
 * <p>Sends one segment as multipart/form-data together with the model name and the Whisper task
 * ({@code transcribe} or {@code translate}) and parses the JSON response. Makes a single attempt
 * per call; every failure surfaces as a {@link TranscriptionEngineException}.
 */
@Component
public class WhisperEngineClient implements TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperEngineClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperEngineClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public SegmentTranscript transcribe(SegmentAudio audio, String model, LanguageMode mode) {
    int index = audio.segment().index();
    LOGGER.debug(
        "Transcribing segment: index={}, file={}, model={}, task={}",
        index,
        audio.file().getFileName(),
        model,
        mode.whisperTask());

    String boundary = UUID.randomUUID().toString();
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + properties.transcribePath()))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(BodyPublishers.ofByteArray(buildMultipartBody(audio, model, mode, boundary)))
              .build();
    } catch (IOException e) {
      throw new TranscriptionEngineException("Failed to read audio for segment " + index, e);
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TranscriptionEngineException(
          "Whisper request failed for segment " + index + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionEngineException("Transcription interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new TranscriptionEngineException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse;
    try {
      whisperResponse = objectMapper.readValue(response.body(), WhisperResponse.class);
    } catch (JsonProcessingException e) {
      throw new TranscriptionEngineException("Unreadable Whisper response", e);
    }

    List<TranscriptCue> cues =
        whisperResponse.segments() == null ? List.of() : whisperResponse.segments();
    LOGGER.debug(
        "Transcription successful: segment={}, cues={}, language={}",
        index,
        cues.size(),
        whisperResponse.language());

    return new SegmentTranscript(index, audio.segment().startSeconds(), cues);
  }

  /**
   * Build a multipart/form-data body.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="segment-0000.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * medium
   * --boundary
   * Content-Disposition: form-data; name="task"
   *
   * translate
   * --boundary--
   * </pre>
   */
  private byte[] buildMultipartBody(
      SegmentAudio audio, String model, LanguageMode mode, String boundary) throws IOException {
    ByteArrayOutputStream body = new ByteArrayOutputStream();

    StringBuilder head = new StringBuilder();
    head.append("--").append(boundary).append("\r\n");
    head.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(audio.file().getFileName())
        .append("\"\r\n");
    head.append("Content-Type: audio/wav\r\n\r\n");
    body.write(head.toString().getBytes(StandardCharsets.UTF_8));
    body.write(Files.readAllBytes(audio.file()));

    StringBuilder tail = new StringBuilder("\r\n");
    appendField(tail, boundary, "model", model);
    appendField(tail, boundary, "task", mode.whisperTask());
    appendField(tail, boundary, "segmentIndex", String.valueOf(audio.segment().index()));
    tail.append("--").append(boundary).append("--\r\n");
    body.write(tail.toString().getBytes(StandardCharsets.UTF_8));

    return body.toByteArray();
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
