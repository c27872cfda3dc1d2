package io.b2mash.governance.integration.storage;

import java.io.InputStream;
import java.util.Map;

/**
 * @param bucket target bucket; null selects the configured default bucket
 * @param key object key
 * @param stream content, read to end-of-stream by the adapter
 * @param contentType MIME type of the content
 * @param visibility "public" for a publicly readable object, anything else keeps it private
 * @param metadata user metadata attached to the object
 */
public record StreamUpload(
    String bucket,
    String key,
    InputStream stream,
    String contentType,
    String visibility,
    Map<String, String> metadata) {

  public static final String VISIBILITY_PUBLIC = "public";
}
