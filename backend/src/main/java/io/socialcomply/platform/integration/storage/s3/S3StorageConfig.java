package io.socialcomply.platform.integration.storage.s3;

import io.socialcomply.platform.integration.storage.StorageProviderConfig;
import io.socialcomply.platform.integration.storage.StorageProviderType;

/**
 * @param accessKeyId static access key; the default AWS credential chain is used when either half
 *     of the key pair is absent
 * @param endpoint override for S3-compatible services (MinIO, LocalStack, R2)
 */
public record S3StorageConfig(
    String region,
    String accessKeyId,
    String secretAccessKey,
    String endpoint,
    boolean forcePathStyle,
    String publicBucket,
    String privateBucket)
    implements StorageProviderConfig {

  @Override
  public StorageProviderType type() {
    return StorageProviderType.S3;
  }

  boolean hasStaticCredentials() {
    return accessKeyId != null
        && !accessKeyId.isBlank()
        && secretAccessKey != null
        && !secretAccessKey.isBlank();
  }

  boolean hasEndpoint() {
    return endpoint != null && !endpoint.isBlank();
  }
}
