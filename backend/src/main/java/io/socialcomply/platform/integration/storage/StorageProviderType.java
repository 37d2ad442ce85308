package io.socialcomply.platform.integration.storage;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Backends the platform can run against, keyed by their configuration slug. */
public enum StorageProviderType {
  LOCAL("local"),
  S3("s3"),
  AZURE_BLOB("azure_blob", "azure"),
  GCS("gcs"),
  REPLIT("replit");

  private final String slug;
  private final String[] aliases;

  StorageProviderType(String slug, String... aliases) {
    this.slug = slug;
    this.aliases = aliases;
  }

  public String getSlug() {
    return slug;
  }

  /**
   * Resolves a configured provider name (case-insensitive, aliases accepted).
   *
   * @throws StorageException {@code CONFIGURATION_ERROR} for an unknown name
   */
  public static StorageProviderType fromSlug(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (StorageProviderType type : values()) {
      if (type.slug.equals(normalized) || Arrays.asList(type.aliases).contains(normalized)) {
        return type;
      }
    }
    throw new StorageException(
        "Unknown storage provider type: "
            + value
            + ". Supported types: "
            + Arrays.stream(values()).map(t -> t.slug).collect(Collectors.joining(", ")),
        StorageErrorCode.CONFIGURATION_ERROR,
        null,
        null);
  }
}
