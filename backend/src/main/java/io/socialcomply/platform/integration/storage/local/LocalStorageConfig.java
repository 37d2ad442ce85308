package io.socialcomply.platform.integration.storage.local;

import io.socialcomply.platform.integration.storage.StorageProviderConfig;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import java.nio.file.Path;

/**
 * @param basePath root directory holding both bucket directories
 * @param publicUrl externally reachable base URL of this service; required for signed and public
 *     URLs
 * @param signingSecret HMAC key for signed URLs; a random per-process key is used when absent
 */
public record LocalStorageConfig(
    Path basePath,
    String publicBucket,
    String privateBucket,
    String publicUrl,
    String signingSecret)
    implements StorageProviderConfig {

  @Override
  public StorageProviderType type() {
    return StorageProviderType.LOCAL;
  }
}
