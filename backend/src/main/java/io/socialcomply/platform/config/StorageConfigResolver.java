package io.socialcomply.platform.config;

import io.socialcomply.platform.integration.storage.StorageErrorCode;
import io.socialcomply.platform.integration.storage.StorageException;
import io.socialcomply.platform.integration.storage.StorageProviderConfig;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import io.socialcomply.platform.integration.storage.azure.AzureBlobStorageConfig;
import io.socialcomply.platform.integration.storage.gcs.GcsStorageConfig;
import io.socialcomply.platform.integration.storage.local.LocalStorageConfig;
import io.socialcomply.platform.integration.storage.replit.ReplitStorageConfig;
import io.socialcomply.platform.integration.storage.s3.S3StorageConfig;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns bound {@link StorageProperties} into the typed config of the selected backend. Bucket
 * names resolve as backend-specific setting, then {@code storage.public-bucket}/{@code
 * storage.private-bucket}, then the backend default.
 */
@Component
public class StorageConfigResolver {

  static final String DEFAULT_PROVIDER = "local";
  static final String DEFAULT_S3_REGION = "us-east-1";
  static final String DEFAULT_PUBLIC_BUCKET = "public";
  static final String DEFAULT_PRIVATE_BUCKET = "private";
  static final String DEFAULT_LOCAL_BASE_PATH = "./data/storage";
  static final String DEFAULT_LOCAL_PRIVATE_DIR = ".private";
  static final String DEFAULT_SIDECAR_ENDPOINT = "http://127.0.0.1:1106";

  /**
   * @throws StorageException {@code CONFIGURATION_ERROR} for an unknown provider or missing
   *     required settings
   */
  public StorageProviderConfig resolve(StorageProperties properties) {
    String slug = hasText(properties.provider()) ? properties.provider() : DEFAULT_PROVIDER;
    StorageProviderType type = StorageProviderType.fromSlug(slug);
    return switch (type) {
      case LOCAL -> local(properties);
      case S3 -> s3(properties);
      case AZURE_BLOB -> azure(properties);
      case GCS -> gcs(properties);
      case REPLIT -> replit(properties);
    };
  }

  private LocalStorageConfig local(StorageProperties properties) {
    var local =
        properties.local() != null
            ? properties.local()
            : new StorageProperties.Local(null, null, null);
    return new LocalStorageConfig(
        Path.of(firstText(local.basePath(), DEFAULT_LOCAL_BASE_PATH)),
        firstText(properties.publicBucket(), DEFAULT_PUBLIC_BUCKET),
        firstText(properties.privateBucket(), DEFAULT_LOCAL_PRIVATE_DIR),
        blankToNull(local.publicUrl()),
        blankToNull(local.signingSecret()));
  }

  private S3StorageConfig s3(StorageProperties properties) {
    var s3 =
        properties.s3() != null
            ? properties.s3()
            : new StorageProperties.S3(null, null, null, null, null, null, null);
    String endpoint = blankToNull(s3.endpoint());
    boolean forcePathStyle =
        s3.forcePathStyle() != null ? s3.forcePathStyle() : endpoint != null;
    return new S3StorageConfig(
        firstText(s3.region(), DEFAULT_S3_REGION),
        blankToNull(s3.accessKeyId()),
        blankToNull(s3.secretAccessKey()),
        endpoint,
        forcePathStyle,
        firstText(s3.publicBucket(), properties.publicBucket(), DEFAULT_PUBLIC_BUCKET),
        firstText(s3.privateBucket(), properties.privateBucket(), DEFAULT_PRIVATE_BUCKET));
  }

  private AzureBlobStorageConfig azure(StorageProperties properties) {
    var azure =
        properties.azure() != null
            ? properties.azure()
            : new StorageProperties.Azure(null, null, null, null, null);
    boolean hasConnectionString = hasText(azure.connectionString());
    boolean hasAccountKey = hasText(azure.accountName()) && hasText(azure.accountKey());
    if (!hasConnectionString && !hasAccountKey) {
      throw misconfigured(
          "Azure Blob storage requires AZURE_STORAGE_CONNECTION_STRING or"
              + " AZURE_STORAGE_ACCOUNT_NAME with AZURE_STORAGE_ACCOUNT_KEY");
    }
    return new AzureBlobStorageConfig(
        blankToNull(azure.accountName()),
        blankToNull(azure.accountKey()),
        blankToNull(azure.connectionString()),
        firstText(azure.publicContainer(), properties.publicBucket(), DEFAULT_PUBLIC_BUCKET),
        firstText(azure.privateContainer(), properties.privateBucket(), DEFAULT_PRIVATE_BUCKET));
  }

  private GcsStorageConfig gcs(StorageProperties properties) {
    var gcs =
        properties.gcs() != null
            ? properties.gcs()
            : new StorageProperties.Gcs(null, null, null, null);
    return new GcsStorageConfig(
        blankToNull(gcs.projectId()),
        blankToNull(gcs.keyFilename()),
        firstText(gcs.publicBucket(), properties.publicBucket(), DEFAULT_PUBLIC_BUCKET),
        firstText(gcs.privateBucket(), properties.privateBucket(), DEFAULT_PRIVATE_BUCKET));
  }

  private ReplitStorageConfig replit(StorageProperties properties) {
    var replit =
        properties.replit() != null
            ? properties.replit()
            : new StorageProperties.Replit(null, null, null, null);
    if (!hasText(replit.privateObjectDir())) {
      throw misconfigured("Replit object storage requires PRIVATE_OBJECT_DIR");
    }
    return new ReplitStorageConfig(
        firstText(replit.sidecarEndpoint(), DEFAULT_SIDECAR_ENDPOINT),
        splitSearchPaths(replit.publicSearchPaths()),
        replit.privateObjectDir().trim(),
        blankToNull(replit.publicUrl()));
  }

  /** Comma-separated list, trimmed, empties dropped, first occurrence wins. */
  static List<String> splitSearchPaths(String raw) {
    if (!hasText(raw)) {
      return List.of();
    }
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(path -> !path.isEmpty())
        .distinct()
        .toList();
  }

  private static StorageException misconfigured(String message) {
    return new StorageException(message, StorageErrorCode.CONFIGURATION_ERROR, null, null);
  }

  private static String firstText(String... candidates) {
    return Arrays.stream(candidates)
        .filter(StorageConfigResolver::hasText)
        .map(String::trim)
        .findFirst()
        .orElse(null);
  }

  private static String blankToNull(String value) {
    return hasText(value) ? value.trim() : null;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
