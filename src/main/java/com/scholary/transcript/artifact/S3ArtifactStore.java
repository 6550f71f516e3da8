package com.scholary.transcript.artifact;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ArtifactStore.
 *
 * <p>Works against real S3 and S3-compatible services like MinIO; the client passed in carries
 * the endpoint and path-style settings. A single PutObject is atomic on S3, so readers never see a
 * partial artifact.
 *
 * <p>The SDK retries transient failures (network issues, 5xx, throttling) on its own. Anything
 * that still fails surfaces as {@link ArtifactStoreException}, except a missing key which is
 * {@link ArtifactNotFoundException}.
 */
public class S3ArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactStore.class);

  private final S3Client s3Client;
  private final String bucket;

  public S3ArtifactStore(S3Client s3Client, String bucket) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    LOGGER.info("S3 artifact store initialized: bucket={}", bucket);
  }

  @Override
  public ArtifactLocation put(ArtifactKind kind, String jobId, String filename, byte[] bytes) {
    ArtifactLocation location = ArtifactLocation.of(kind, jobId, filename);
    LOGGER.debug(
        "Uploading artifact: bucket={}, key={}, contentLength={}", bucket, location, bytes.length);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(location.key())
              .contentType(kind.contentType())
              .contentLength((long) bytes.length)
              .build();
      s3Client.putObject(request, RequestBody.fromBytes(bytes));
      return location;

    } catch (S3Exception e) {
      throw failure("Failed to upload artifact", location, e);
    }
  }

  @Override
  public byte[] get(ArtifactLocation location) {
    LOGGER.debug("Fetching artifact: bucket={}, key={}", bucket, location);

    try {
      GetObjectRequest request =
          GetObjectRequest.builder().bucket(bucket).key(location.key()).build();
      return s3Client.getObjectAsBytes(request).asByteArray();

    } catch (NoSuchKeyException e) {
      throw new ArtifactNotFoundException(location, e);

    } catch (S3Exception e) {
      throw failure("Failed to retrieve artifact", location, e);
    }
  }

  @Override
  public boolean exists(ArtifactLocation location) {
    try {
      s3Client.headObject(
          HeadObjectRequest.builder().bucket(bucket).key(location.key()).build());
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      // HEAD responses carry no body, so a missing key can come back as a bare 404
      if (e.statusCode() == 404) {
        return false;
      }
      throw failure("Failed to check artifact", location, e);
    }
  }

  @Override
  public void delete(ArtifactLocation location) {
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucket).key(location.key()).build());
      LOGGER.debug("Deleted artifact: bucket={}, key={}", bucket, location);

    } catch (S3Exception e) {
      throw failure("Failed to delete artifact", location, e);
    }
  }

  @Override
  public int deleteAll(ArtifactKind kind, String jobId) {
    String prefix = ArtifactLocation.jobPrefix(kind, jobId);
    int deleted = 0;
    String continuationToken = null;

    try {
      do {
        ListObjectsV2Response listing =
            s3Client.listObjectsV2(
                ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .continuationToken(continuationToken)
                    .build());

        List<ObjectIdentifier> keys =
            listing.contents().stream()
                .map(object -> ObjectIdentifier.builder().key(object.key()).build())
                .toList();
        if (!keys.isEmpty()) {
          s3Client.deleteObjects(
              DeleteObjectsRequest.builder()
                  .bucket(bucket)
                  .delete(Delete.builder().objects(keys).quiet(true).build())
                  .build());
          deleted += keys.size();
        }

        continuationToken =
            Boolean.TRUE.equals(listing.isTruncated()) ? listing.nextContinuationToken() : null;
      } while (continuationToken != null);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete artifacts: bucket=%s, prefix=%s, statusCode=%s",
              bucket, prefix, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }

    LOGGER.debug("Deleted {} {} artifact(s) for job {}", deleted, kind, jobId);
    return deleted;
  }

  private ArtifactStoreException failure(String what, ArtifactLocation location, S3Exception e) {
    String message =
        String.format(
            "%s: bucket=%s, key=%s, statusCode=%s", what, bucket, location, e.statusCode());
    LOGGER.error(message, e);
    return new ArtifactStoreException(message, e);
  }
}
