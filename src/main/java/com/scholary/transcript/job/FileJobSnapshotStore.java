package com.scholary.transcript.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each job as {@code <root>/<jobId>/job.json}.
 *
 * <p>Snapshots are written to a temp file and renamed over the previous one. A snapshot that
 * cannot be parsed is logged and skipped by {@link #loadAll()} so one corrupt file does not block
 * recovery of the others.
 */
public class FileJobSnapshotStore implements JobSnapshotStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileJobSnapshotStore.class);

  private static final String SNAPSHOT_FILE = "job.json";

  private final Path root;
  private final ObjectMapper objectMapper;

  public FileJobSnapshotStore(Path root, ObjectMapper objectMapper) {
    this.root = root.toAbsolutePath().normalize();
    this.objectMapper = objectMapper;
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new JobStoreException("Cannot create job snapshot directory " + this.root, e);
    }
  }

  @Override
  public void save(TranscriptionJob job) {
    Path dir = root.resolve(job.getId());
    try {
      Files.createDirectories(dir);
      Path temp = Files.createTempFile(dir, ".job-", ".tmp");
      try {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), job);
        move(temp, dir.resolve(SNAPSHOT_FILE));
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new JobStoreException("Failed to save snapshot of job " + job.getId(), e);
    }
  }

  @Override
  public Optional<TranscriptionJob> load(String jobId) {
    Path file = root.resolve(jobId).resolve(SNAPSHOT_FILE).normalize();
    if (!file.startsWith(root) || !Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(file.toFile(), TranscriptionJob.class));
    } catch (IOException e) {
      throw new JobStoreException("Failed to read snapshot of job " + jobId, e);
    }
  }

  @Override
  public List<TranscriptionJob> loadAll() {
    List<TranscriptionJob> jobs = new ArrayList<>();
    try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
      for (Path dir : dirs) {
        String jobId = dir.getFileName().toString();
        try {
          load(jobId).ifPresent(jobs::add);
        } catch (JobStoreException e) {
          LOGGER.error("Skipping unreadable job snapshot: jobId={}", jobId, e);
        }
      }
    } catch (IOException e) {
      throw new JobStoreException("Failed to list job snapshots under " + root, e);
    }
    return jobs;
  }

  @Override
  public void delete(String jobId) {
    Path dir = root.resolve(jobId).normalize();
    if (!dir.startsWith(root) || dir.equals(root)) {
      return;
    }
    try {
      Files.deleteIfExists(dir.resolve(SNAPSHOT_FILE));
      Files.deleteIfExists(dir);
    } catch (IOException e) {
      throw new JobStoreException("Failed to delete snapshot of job " + jobId, e);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
