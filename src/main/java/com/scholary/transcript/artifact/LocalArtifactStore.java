package com.scholary.transcript.artifact;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem implementation of ArtifactStore.
 *
 * <p>Artifacts live under a root directory, one file per key. Writes go to a temp file in the
 * target directory and are then renamed into place, so readers see either the old artifact or the
 * new one.
 */
public class LocalArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);

  private final Path root;

  public LocalArtifactStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new ArtifactStoreException("Cannot create artifact root " + this.root, e);
    }
    LOGGER.info("Local artifact store initialized: root={}", this.root);
  }

  @Override
  public ArtifactLocation put(ArtifactKind kind, String jobId, String filename, byte[] bytes) {
    ArtifactLocation location = ArtifactLocation.of(kind, jobId, filename);
    Path target = resolve(location);
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), ".put-", ".tmp");
      Files.write(temp, bytes);
      moveIntoPlace(temp, target);
      LOGGER.debug("Stored artifact: key={}, bytes={}", location, bytes.length);
      return location;
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new ArtifactStoreException("Failed to store artifact: key=" + location, e);
    }
  }

  @Override
  public byte[] get(ArtifactLocation location) {
    try {
      return Files.readAllBytes(resolve(location));
    } catch (NoSuchFileException e) {
      throw new ArtifactNotFoundException(location, e);
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to read artifact: key=" + location, e);
    }
  }

  @Override
  public boolean exists(ArtifactLocation location) {
    return Files.isRegularFile(resolve(location));
  }

  @Override
  public void delete(ArtifactLocation location) {
    try {
      Files.deleteIfExists(resolve(location));
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to delete artifact: key=" + location, e);
    }
  }

  @Override
  public int deleteAll(ArtifactKind kind, String jobId) {
    Path dir = resolve(ArtifactLocation.jobPrefix(kind, jobId));
    if (!Files.isDirectory(dir)) {
      return 0;
    }
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(dir)) {
      paths = walk.sorted(Comparator.reverseOrder()).toList();
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to list artifacts under " + dir, e);
    }

    int deleted = 0;
    try {
      for (Path path : paths) {
        boolean file = Files.isRegularFile(path);
        Files.deleteIfExists(path);
        if (file) {
          deleted++;
        }
      }
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to delete artifacts under " + dir, e);
    }
    LOGGER.debug("Deleted {} {} artifact(s) for job {}", deleted, kind, jobId);
    return deleted;
  }

  private Path resolve(ArtifactLocation location) {
    return resolve(location.key());
  }

  private Path resolve(String key) {
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root)) {
      throw new ArtifactStoreException("Artifact key escapes the store root: " + key);
    }
    return path;
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up temp file {}: {}", path, e.getMessage());
    }
  }
}
