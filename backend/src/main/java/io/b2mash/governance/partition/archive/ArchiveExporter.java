package io.b2mash.governance.partition.archive;

import io.b2mash.governance.integration.storage.StorageService;
import io.b2mash.governance.integration.storage.StoredObject;
import io.b2mash.governance.integration.storage.StreamUpload;
import io.b2mash.governance.partition.ArchiveRecord;
import io.b2mash.governance.partition.ArchiveRecordRepository;
import io.b2mash.governance.partition.PartitionDescriptor;
import io.b2mash.governance.partition.PartitionPolicy;
import io.b2mash.governance.partition.PartitionProperties;
import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.temporal.TemporalAccessor;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import tools.jackson.databind.json.JsonMapper;

/**
 * Exports one partition to object storage as newline-delimited JSON.
 *
 * <p>Rows are serialized on the calling thread and piped to an upload running on the archive
 * upload executor, so at most one pipe buffer and one storage part are held in memory. The
 * SHA-256 checksum and byte size cover the uncompressed NDJSON. A manifest row is written only
 * after the upload completes; any failure (including an exceeded row or byte ceiling) aborts the
 * upload and leaves no manifest. An aborted export closes the writing end of the pipe and the
 * upload reads that end-of-stream as a failure, so the upload thread is never interrupted while
 * storage cleans up a partial upload.
 */
@Service
public class ArchiveExporter {

  private static final Logger log = LoggerFactory.getLogger(ArchiveExporter.class);

  static final String CONTENT_TYPE_NDJSON = "application/x-ndjson";
  static final String CONTENT_TYPE_GZIP = "application/gzip";
  private static final int PIPE_BUFFER_SIZE = 64 * 1024;
  private static final byte NEWLINE = '\n';

  private final PartitionRowReader rowReader;
  private final StorageService storageService;
  private final ArchiveRecordRepository archiveRecordRepository;
  private final ThreadPoolTaskExecutor uploadExecutor;
  private final PartitionProperties properties;
  private final JsonMapper jsonMapper;
  private final Clock clock;

  public ArchiveExporter(
      PartitionRowReader rowReader,
      StorageService storageService,
      ArchiveRecordRepository archiveRecordRepository,
      @Qualifier("archiveUploadExecutor") ThreadPoolTaskExecutor uploadExecutor,
      PartitionProperties properties,
      @Qualifier("governanceJsonMapper") JsonMapper jsonMapper,
      Clock clock) {
    this.rowReader = rowReader;
    this.storageService = storageService;
    this.archiveRecordRepository = archiveRecordRepository;
    this.uploadExecutor = uploadExecutor;
    this.properties = properties;
    this.jsonMapper = jsonMapper;
    this.clock = clock;
  }

  public ArchiveResult export(ArchiveRequest request) {
    PartitionPolicy policy = request.policy();
    PartitionDescriptor partition = request.partition();
    boolean compress = properties.archive().compress();
    String prefix = normalizePrefix(request.prefix());
    String key = buildKey(prefix, policy.tableName(), partition.name(), compress);

    var pipeSource = new PipedInputStream(PIPE_BUFFER_SIZE);
    var uploadSource = new AbortableSource(pipeSource);
    PipedOutputStream pipe;
    try {
      pipe = new PipedOutputStream(pipeSource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open archive pipe", e);
    }

    var upload =
        new StreamUpload(
            request.bucket(),
            key,
            uploadSource,
            compress ? CONTENT_TYPE_GZIP : CONTENT_TYPE_NDJSON,
            request.visibility(),
            Map.of(
                "partition-table", policy.tableName(),
                "partition-name", partition.name(),
                "retention-days", String.valueOf(policy.retentionDays()),
                "run-id", String.valueOf(request.runId())));
    Future<StoredObject> pendingUpload =
        uploadExecutor
            .getThreadPoolExecutor()
            .submit(
                () -> {
                  try {
                    return storageService.uploadStream(upload);
                  } finally {
                    closeQuietly(uploadSource);
                  }
                });

    var stats = new ExportStats();
    boolean streamed = false;
    try {
      OutputStream sink = compress ? new GZIPOutputStream(pipe, PIPE_BUFFER_SIZE) : pipe;
      rowReader.streamRows(policy, partition, row -> writeRow(sink, row, stats));
      sink.close();
      streamed = true;
    } catch (IOException e) {
      throw uploadFailureOr(pendingUpload, new UncheckedIOException(e));
    } catch (UncheckedIOException e) {
      throw uploadFailureOr(pendingUpload, e);
    } finally {
      if (!streamed) {
        // abort before closing: the upload must fail rather than see end-of-stream
        uploadSource.abort();
        closeQuietly(pipe);
        pendingUpload.cancel(false);
        log.warn(
            "Aborted archive export of {}.{} after {} rows",
            policy.tableName(),
            partition.name(),
            stats.rowCount);
      }
    }

    StoredObject stored = awaitUpload(pendingUpload, key);
    String checksum = HexFormat.of().formatHex(stats.digest.digest());

    var metadata = new LinkedHashMap<String, Object>();
    metadata.put("policyId", policy.id());
    metadata.put("strategy", policy.strategy());
    metadata.put("visibility", request.visibility());
    metadata.put("prefix", prefix);
    metadata.put("compressed", compress);
    metadata.put("runId", request.runId());
    ArchiveRecord record =
        archiveRecordRepository.save(
            new ArchiveRecord(
                policy.tableName(),
                partition,
                policy.retentionDays(),
                clock.instant(),
                stored.bucket(),
                stored.key(),
                stats.rowCount,
                stats.byteSize,
                checksum,
                metadata));

    log.info(
        "Archived partition {}.{} to s3://{}/{}: rows={}, bytes={}, sha256={}",
        policy.tableName(),
        partition.name(),
        stored.bucket(),
        stored.key(),
        stats.rowCount,
        stats.byteSize,
        checksum);
    return new ArchiveResult(
        record.getId(), stored.bucket(), stored.key(), stats.rowCount, stats.byteSize, checksum);
  }

  private void writeRow(OutputStream sink, Map<String, Object> row, ExportStats stats) {
    byte[] json = jsonMapper.writeValueAsBytes(normalize(row));
    long nextRows = stats.rowCount + 1;
    long nextBytes = stats.byteSize + json.length + 1;
    Long maxRows = properties.maxExportRows();
    Long maxBytes = properties.maxExportBytes();
    if (maxRows != null && maxRows > 0 && nextRows > maxRows) {
      throw new ArchiveLimitExceededException(
          "Partition export exceeded maximum row limit (" + maxRows + ")");
    }
    if (maxBytes != null && maxBytes > 0 && nextBytes > maxBytes) {
      throw new ArchiveLimitExceededException(
          "Partition export exceeded maximum size limit (" + maxBytes + " bytes)");
    }
    stats.rowCount = nextRows;
    stats.byteSize = nextBytes;
    stats.digest.update(json);
    stats.digest.update(NEWLINE);
    try {
      sink.write(json);
      sink.write(NEWLINE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write archive stream", e);
    }
  }

  static Map<String, Object> normalize(Map<String, Object> row) {
    var normalized = new LinkedHashMap<String, Object>(row.size());
    row.forEach((column, value) -> normalized.put(column, normalizeValue(value)));
    return normalized;
  }

  private static Object normalizeValue(Object value) {
    if (value == null
        || value instanceof String
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof UUID
        || value instanceof TemporalAccessor
        || value instanceof byte[]
        || value instanceof Map
        || value instanceof List) {
      return value;
    }
    if (value instanceof Timestamp timestamp) {
      return timestamp.toInstant();
    }
    if (value instanceof java.sql.Date date) {
      return date.toLocalDate();
    }
    if (value instanceof Time time) {
      return time.toLocalTime();
    }
    return value.toString();
  }

  static String normalizePrefix(String prefix) {
    if (prefix == null) {
      return "";
    }
    return prefix.trim().replaceAll("^/+", "").replaceAll("/+$", "");
  }

  private String buildKey(String prefix, String table, String partition, boolean compress) {
    String fileName =
        "%s-%s-%d-%s.ndjson%s"
            .formatted(table, partition, clock.millis(), UUID.randomUUID(), compress ? ".gz" : "");
    String path = table + "/" + partition + "/" + fileName;
    return prefix.isEmpty() ? path : prefix + "/" + path;
  }

  private static StoredObject awaitUpload(Future<StoredObject> pendingUpload, String key) {
    try {
      return pendingUpload.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pendingUpload.cancel(true);
      throw new IllegalStateException("Interrupted while uploading archive " + key, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Archive upload failed for " + key, e.getCause());
    }
  }

  /** A pipe error usually means the upload died first; report the upload's failure instead. */
  private static RuntimeException uploadFailureOr(
      Future<StoredObject> pendingUpload, RuntimeException streamFailure) {
    if (pendingUpload.isDone() && !pendingUpload.isCancelled()) {
      try {
        pendingUpload.get();
      } catch (ExecutionException e) {
        if (e.getCause() instanceof RuntimeException runtime) {
          runtime.addSuppressed(streamFailure);
          return runtime;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    return streamFailure;
  }

  private static void closeQuietly(Closeable stream) {
    try {
      stream.close();
    } catch (IOException e) {
      log.debug("Ignoring failure closing archive pipe: {}", e.getMessage());
    }
  }

  /** Upload side of the pipe; once aborted, end-of-stream surfaces as an {@link IOException}. */
  static final class AbortableSource extends FilterInputStream {

    private final AtomicBoolean aborted = new AtomicBoolean();

    AbortableSource(InputStream source) {
      super(source);
    }

    void abort() {
      aborted.set(true);
    }

    @Override
    public int read() throws IOException {
      return checkEnd(super.read());
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
      return checkEnd(super.read(buffer, offset, length));
    }

    private int checkEnd(int result) throws IOException {
      if (result < 0 && aborted.get()) {
        throw new IOException("Archive export aborted");
      }
      return result;
    }
  }

  private static final class ExportStats {
    private final MessageDigest digest = sha256();
    private long rowCount;
    private long byteSize;
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
