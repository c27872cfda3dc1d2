package io.b2mash.governance.integration.storage.s3;

import io.b2mash.governance.config.S3Config.S3Properties;
import io.b2mash.governance.integration.storage.StorageService;
import io.b2mash.governance.integration.storage.StoredObject;
import io.b2mash.governance.integration.storage.StreamUpload;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

/**
 * S3 implementation of {@link StorageService}. All AWS SDK types are confined to this class.
 *
 * <p>Streams are read one part at a time. Content that fits in a single part is sent with one
 * {@code PutObject}; anything larger goes through a multipart upload, which is aborted if the
 * stream fails midway.
 */
@Component
public class S3StorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(S3StorageAdapter.class);

  static final int DEFAULT_PART_SIZE = 8 * 1024 * 1024;

  private final S3Client s3Client;
  private final String defaultBucket;
  private final int partSize;

  @Autowired
  public S3StorageAdapter(S3Client s3Client, S3Properties s3Properties) {
    this(s3Client, s3Properties.bucketName(), DEFAULT_PART_SIZE);
  }

  /** Package-private constructor for testing with a small part size. */
  S3StorageAdapter(S3Client s3Client, String defaultBucket, int partSize) {
    this.s3Client = s3Client;
    this.defaultBucket = defaultBucket;
    this.partSize = partSize;
  }

  @Override
  public StoredObject uploadStream(StreamUpload upload) {
    String bucket = resolveBucket(upload.bucket());
    if (upload.key() == null || upload.key().isBlank()) {
      throw new IllegalArgumentException("Storage key is required");
    }
    InputStream stream = upload.stream();
    try {
      byte[] first = stream.readNBytes(partSize);
      if (first.length < partSize) {
        putSingle(bucket, upload, first);
      } else {
        putMultipart(bucket, upload, first, stream);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read upload stream for key " + upload.key(), e);
    }
    log.info("Uploaded object s3://{}/{}", bucket, upload.key());
    return new StoredObject(bucket, upload.key());
  }

  private void putSingle(String bucket, StreamUpload upload, byte[] content) {
    var builder =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(upload.key())
            .contentType(upload.contentType())
            .metadata(metadataOf(upload));
    if (isPublic(upload)) {
      builder.acl(ObjectCannedACL.PUBLIC_READ);
    }
    s3Client.putObject(builder.build(), RequestBody.fromBytes(content));
  }

  private void putMultipart(String bucket, StreamUpload upload, byte[] first, InputStream stream)
      throws IOException {
    var createBuilder =
        CreateMultipartUploadRequest.builder()
            .bucket(bucket)
            .key(upload.key())
            .contentType(upload.contentType())
            .metadata(metadataOf(upload));
    if (isPublic(upload)) {
      createBuilder.acl(ObjectCannedACL.PUBLIC_READ);
    }
    String uploadId = s3Client.createMultipartUpload(createBuilder.build()).uploadId();
    List<CompletedPart> parts = new ArrayList<>();
    try {
      byte[] chunk = first;
      int partNumber = 1;
      while (chunk.length > 0) {
        var partRequest =
            UploadPartRequest.builder()
                .bucket(bucket)
                .key(upload.key())
                .uploadId(uploadId)
                .partNumber(partNumber)
                .build();
        String eTag = s3Client.uploadPart(partRequest, RequestBody.fromBytes(chunk)).eTag();
        parts.add(CompletedPart.builder().partNumber(partNumber).eTag(eTag).build());
        partNumber++;
        chunk = stream.readNBytes(partSize);
      }
      s3Client.completeMultipartUpload(
          CompleteMultipartUploadRequest.builder()
              .bucket(bucket)
              .key(upload.key())
              .uploadId(uploadId)
              .multipartUpload(CompletedMultipartUpload.builder().parts(parts).build())
              .build());
    } catch (IOException | RuntimeException e) {
      abortQuietly(bucket, upload.key(), uploadId, e);
      throw e;
    }
  }

  private void abortQuietly(String bucket, String key, String uploadId, Exception cause) {
    try {
      s3Client.abortMultipartUpload(
          AbortMultipartUploadRequest.builder()
              .bucket(bucket)
              .key(key)
              .uploadId(uploadId)
              .build());
      log.warn("Aborted multipart upload for s3://{}/{}: {}", bucket, key, cause.getMessage());
    } catch (RuntimeException abortFailure) {
      cause.addSuppressed(abortFailure);
      log.error("Failed to abort multipart upload {} for s3://{}/{}", uploadId, bucket, key);
    }
  }

  private String resolveBucket(String requested) {
    String bucket = requested != null && !requested.isBlank() ? requested : defaultBucket;
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException("No storage bucket configured");
    }
    return bucket;
  }

  private static boolean isPublic(StreamUpload upload) {
    return StreamUpload.VISIBILITY_PUBLIC.equalsIgnoreCase(upload.visibility());
  }

  private static Map<String, String> metadataOf(StreamUpload upload) {
    return upload.metadata() != null ? upload.metadata() : Map.of();
  }
}
