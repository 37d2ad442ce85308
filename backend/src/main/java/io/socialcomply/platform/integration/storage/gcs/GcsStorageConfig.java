package io.socialcomply.platform.integration.storage.gcs;

import io.socialcomply.platform.integration.storage.StorageProviderConfig;
import io.socialcomply.platform.integration.storage.StorageProviderType;

/**
 * @param keyFilename service-account key file; Application Default Credentials are used when
 *     absent, in which case V4 signing only works if those credentials can sign
 */
public record GcsStorageConfig(
    String projectId, String keyFilename, String publicBucket, String privateBucket)
    implements StorageProviderConfig {

  @Override
  public StorageProviderType type() {
    return StorageProviderType.GCS;
  }
}
