package io.b2mash.governance.integration.storage.s3;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.governance.integration.storage.StreamUpload;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

@ExtendWith(MockitoExtension.class)
class S3StorageAdapterTest {

  private static final int PART_SIZE = 8;

  @Mock private S3Client s3Client;

  private S3StorageAdapter adapter(String defaultBucket) {
    return new S3StorageAdapter(s3Client, defaultBucket, PART_SIZE);
  }

  private static StreamUpload upload(String bucket, String content, String visibility) {
    return new StreamUpload(
        bucket,
        "archives/audit_events/p202401.ndjson",
        new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)),
        "application/x-ndjson",
        visibility,
        Map.of("run-id", "run-1"));
  }

  private static String contentOf(RequestBody body) throws IOException {
    try (InputStream in = body.contentStreamProvider().newStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  void uploadStream_smallContent_usesSinglePut() throws IOException {
    var stored = adapter("governance-archives").uploadStream(upload(null, "{\"a\":1}", null));

    assertThat(stored.bucket()).isEqualTo("governance-archives");
    assertThat(stored.key()).isEqualTo("archives/audit_events/p202401.ndjson");

    var request = ArgumentCaptor.forClass(PutObjectRequest.class);
    var body = ArgumentCaptor.forClass(RequestBody.class);
    verify(s3Client).putObject(request.capture(), body.capture());
    assertThat(request.getValue().bucket()).isEqualTo("governance-archives");
    assertThat(request.getValue().contentType()).isEqualTo("application/x-ndjson");
    assertThat(request.getValue().metadata()).containsEntry("run-id", "run-1");
    assertThat(request.getValue().acl()).isNull();
    assertThat(contentOf(body.getValue())).isEqualTo("{\"a\":1}");
    verify(s3Client, never()).createMultipartUpload(any(CreateMultipartUploadRequest.class));
  }

  @Test
  void uploadStream_publicVisibility_setsPublicReadAcl() {
    adapter("governance-archives").uploadStream(upload("public-bucket", "x", "PUBLIC"));

    var request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().bucket()).isEqualTo("public-bucket");
    assertThat(request.getValue().acl()).isEqualTo(ObjectCannedACL.PUBLIC_READ);
  }

  @Test
  void uploadStream_largeContent_usesMultipartUpload() throws IOException {
    when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
        .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-1").build());
    List<String> parts = new ArrayList<>();
    when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
        .thenAnswer(
            inv -> {
              parts.add(contentOf(inv.getArgument(1)));
              return UploadPartResponse.builder().eTag("etag-" + parts.size()).build();
            });

    adapter("governance-archives").uploadStream(upload(null, "0123456789abcdefXYZ", null));

    assertThat(parts).containsExactly("01234567", "89abcdef", "XYZ");
    var complete = ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
    verify(s3Client).completeMultipartUpload(complete.capture());
    assertThat(complete.getValue().uploadId()).isEqualTo("upload-1");
    assertThat(complete.getValue().multipartUpload().parts())
        .extracting(part -> part.partNumber() + ":" + part.eTag())
        .containsExactly("1:etag-1", "2:etag-2", "3:etag-3");
    verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
  }

  @Test
  void uploadStream_streamFailsMidway_abortsMultipartUpload() {
    when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
        .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-2").build());
    when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
        .thenReturn(UploadPartResponse.builder().eTag("etag").build());
    InputStream failing =
        new InputStream() {
          private int served;

          @Override
          public int read() throws IOException {
            if (served >= PART_SIZE) {
              throw new IOException("producer failed");
            }
            served++;
            return 'x';
          }
        };
    var upload =
        new StreamUpload(
            null, "archives/broken.ndjson", failing, "application/x-ndjson", null, null);

    assertThatThrownBy(() -> adapter("governance-archives").uploadStream(upload))
        .isInstanceOf(UncheckedIOException.class)
        .hasRootCauseMessage("producer failed");

    var abort = ArgumentCaptor.forClass(AbortMultipartUploadRequest.class);
    verify(s3Client).abortMultipartUpload(abort.capture());
    assertThat(abort.getValue().uploadId()).isEqualTo("upload-2");
    verify(s3Client, times(1)).uploadPart(any(UploadPartRequest.class), any(RequestBody.class));
    verify(s3Client, never())
        .completeMultipartUpload(any(CompleteMultipartUploadRequest.class));
  }

  @Test
  void uploadStream_noBucketConfigured_fails() {
    assertThatThrownBy(() -> adapter(null).uploadStream(upload(" ", "x", null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("No storage bucket configured");
    verifyNoInteractions(s3Client);
  }

  @Test
  void uploadStream_blankKey_fails() {
    var upload =
        new StreamUpload(
            "bucket", " ", new ByteArrayInputStream(new byte[0]), "text/plain", null, null);

    assertThatThrownBy(() -> adapter("governance-archives").uploadStream(upload))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(s3Client);
  }
}
