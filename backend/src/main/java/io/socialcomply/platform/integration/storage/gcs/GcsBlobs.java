package io.socialcomply.platform.integration.storage.gcs;

import com.google.cloud.storage.Blob;
import io.socialcomply.platform.integration.storage.StorageMetadata;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** Conversions from Cloud Storage blobs, shared by the GCS-backed adapters. */
public final class GcsBlobs {

  public static final String PUBLIC_HOST = "https://storage.googleapis.com/";

  private GcsBlobs() {}

  public static StorageMetadata toMetadata(Blob blob) {
    Long updated = blob.getUpdateTime();
    return new StorageMetadata(
        blob.getContentType(),
        blob.getSize(),
        updated != null ? Instant.ofEpochMilli(updated) : null,
        blob.getEtag(),
        customMetadata(blob));
  }

  /** User metadata without the entries Cloud Storage reports as cleared (null values). */
  public static Map<String, String> customMetadata(Blob blob) {
    Map<String, String> metadata = blob.getMetadata();
    if (metadata == null) {
      return Map.of();
    }
    var result = new HashMap<String, String>();
    metadata.forEach(
        (name, value) -> {
          if (value != null) {
            result.put(name, value);
          }
        });
    return result;
  }
}
