package io.socialcomply.platform.integration.storage;

import java.util.Map;

/**
 * Per-upload settings.
 *
 * @param contentType MIME type recorded with the object; defaults to {@code
 *     application/octet-stream}
 * @param metadata free-form string metadata stored with the object
 * @param isPublic requests public visibility at write time (ACL on S3/GCS, public directory for
 *     unprefixed keys on the local adapter)
 */
public record UploadOptions(String contentType, Map<String, String> metadata, boolean isPublic) {

  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  public UploadOptions {
    contentType = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static UploadOptions defaults() {
    return new UploadOptions(null, null, false);
  }

  public static UploadOptions ofContentType(String contentType) {
    return new UploadOptions(contentType, null, false);
  }

  public static UploadOptions publicObject(String contentType) {
    return new UploadOptions(contentType, null, true);
  }
}
