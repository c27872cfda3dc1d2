package io.b2mash.governance.integration.storage;

/**
 * Abstraction for object storage operations. Governance services inject this interface instead of
 * vendor-specific clients (e.g., S3Client).
 */
public interface StorageService {

  /**
   * Uploads a stream of unknown length. The stream is read until end-of-stream; an exception from
   * the stream aborts the upload and leaves no object behind.
   */
  StoredObject uploadStream(StreamUpload upload);
}
