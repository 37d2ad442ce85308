package io.socialcomply.platform.integration.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Normalized object descriptor. {@code size} and {@code lastModified} always come from the backend
 * and may be {@code null} when the backend does not report them (e.g. S3 listings have no content
 * type).
 */
public record StorageMetadata(
    String contentType,
    Long size,
    Instant lastModified,
    String etag,
    Map<String, String> customMetadata) {

  public StorageMetadata {
    customMetadata = customMetadata == null ? Map.of() : Map.copyOf(customMetadata);
  }
}
