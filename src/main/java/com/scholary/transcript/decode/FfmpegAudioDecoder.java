package com.scholary.transcript.decode;

import com.scholary.transcript.segment.Segment;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes media with ffmpeg.
 *
 * <p>The whole input is first converted to a 16 kHz mono WAV; the duration is then read from the
 * WAV header, which is exact for PCM. Segments are cut from that WAV, so every segment of a job
 * comes from the same decoded bytes on every run.
 */
@Component
public class FfmpegAudioDecoder implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioDecoder.class);

  private static final String DECODED_FILENAME = "decoded.wav";

  private final FfmpegProperties properties;

  public FfmpegAudioDecoder(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public DecodedAudio decode(Path inputFile, Path scratchDir) {
    if (!Files.isRegularFile(inputFile)) {
      throw new AudioDecodingException("Input file not found: " + inputFile);
    }
    LOGGER.info("Decoding input: {}", inputFile.getFileName());

    Path output = scratchDir.resolve(DECODED_FILENAME);
    run(
        List.of(
            properties.binary(),
            "-hide_banner",
            "-loglevel",
            "error",
            "-y",
            "-i",
            inputFile.toString(),
            "-vn",
            "-ac",
            String.valueOf(properties.channels()),
            "-ar",
            String.valueOf(properties.sampleRate()),
            output.toString()),
        scratchDir,
        "decode " + inputFile.getFileName());

    double duration = readDuration(output);
    LOGGER.info("Decoded audio: duration={}s", duration);
    return new DecodedAudio(output, duration);
  }

  @Override
  public Path extract(DecodedAudio audio, Segment segment, Path target) {
    run(
        List.of(
            properties.binary(),
            "-hide_banner",
            "-loglevel",
            "error",
            "-y",
            "-ss",
            String.format(Locale.ROOT, "%.3f", segment.startSeconds()),
            "-t",
            String.format(Locale.ROOT, "%.3f", segment.duration()),
            "-i",
            audio.file().toString(),
            "-c",
            "copy",
            target.toString()),
        target.toAbsolutePath().getParent(),
        "extract segment " + segment.index());
    return target;
  }

  private double readDuration(Path wav) {
    try {
      AudioFileFormat format = AudioSystem.getAudioFileFormat(wav.toFile());
      long frames = format.getFrameLength();
      float frameRate = format.getFormat().getFrameRate();
      if (frames == AudioSystem.NOT_SPECIFIED || frameRate <= 0) {
        throw new AudioDecodingException("Decoded audio has no readable duration");
      }
      return frames / (double) frameRate;
    } catch (UnsupportedAudioFileException | IOException e) {
      throw new AudioDecodingException("Failed to read decoded audio header", e);
    }
  }

  /**
   * Run ffmpeg to completion or until the configured timeout. Output goes to a log file in
   * {@code workDir} so a process that never closes its streams cannot block the wait.
   */
  private void run(List<String> command, Path workDir, String description) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path logFile;
    try {
      logFile = Files.createTempFile(workDir, "ffmpeg-", ".log");
    } catch (IOException e) {
      throw new AudioDecodingException("Failed to create ffmpeg log for " + description, e);
    }

    try {
      Process process;
      try {
        process =
            new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
      } catch (IOException e) {
        throw new AudioDecodingException("Failed to start ffmpeg for " + description, e);
      }

      try {
        if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
          process.destroyForcibly();
          throw new AudioDecodingException(
              String.format(
                  "ffmpeg timed out after %ds during %s",
                  properties.timeoutSeconds(), description));
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new AudioDecodingException("Interrupted during " + description, e);
      }

      if (process.exitValue() != 0) {
        throw new AudioDecodingException(
            String.format(
                "ffmpeg failed during %s (exit %d): %s",
                description, process.exitValue(), readLog(logFile)));
      }
    } finally {
      try {
        Files.deleteIfExists(logFile);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete ffmpeg log {}: {}", logFile, e.getMessage());
      }
    }
  }

  private static String readLog(Path logFile) {
    try {
      return Files.readString(logFile, StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      return "(log unreadable: " + e.getMessage() + ")";
    }
  }
}
