package io.b2mash.governance.partition.archive;

import java.util.UUID;

/**
 * @param archiveId id of the persisted archive manifest
 * @param checksum hex SHA-256 of the uncompressed NDJSON
 */
public record ArchiveResult(
    UUID archiveId, String bucket, String key, long rowCount, long byteSize, String checksum) {}
