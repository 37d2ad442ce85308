package io.socialcomply.platform.integration.storage.azure;

import io.socialcomply.platform.integration.storage.StorageProviderConfig;
import io.socialcomply.platform.integration.storage.StorageProviderType;

/** Either {@code connectionString} or {@code accountName} plus {@code accountKey} is required. */
public record AzureBlobStorageConfig(
    String accountName,
    String accountKey,
    String connectionString,
    String publicContainer,
    String privateContainer)
    implements StorageProviderConfig {

  @Override
  public StorageProviderType type() {
    return StorageProviderType.AZURE_BLOB;
  }

  boolean hasConnectionString() {
    return connectionString != null && !connectionString.isBlank();
  }

  boolean hasAccountKey() {
    return accountName != null
        && !accountName.isBlank()
        && accountKey != null
        && !accountKey.isBlank();
  }
}
