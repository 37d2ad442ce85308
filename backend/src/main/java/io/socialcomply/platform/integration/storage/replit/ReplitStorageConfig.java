package io.socialcomply.platform.integration.storage.replit;

import io.socialcomply.platform.integration.storage.StorageProviderConfig;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import java.util.List;

/**
 * @param sidecarEndpoint base URL of the credential and signing sidecar
 * @param publicSearchPaths {@code /bucket/dir} roots probed in order for public objects; the first
 *     one receives {@code public/} keys
 * @param privateObjectDir {@code /bucket/dir} root for private and unprefixed keys
 * @param publicUrl optional base URL serving the first public search path
 */
public record ReplitStorageConfig(
    String sidecarEndpoint,
    List<String> publicSearchPaths,
    String privateObjectDir,
    String publicUrl)
    implements StorageProviderConfig {

  public ReplitStorageConfig {
    publicSearchPaths = publicSearchPaths == null ? List.of() : List.copyOf(publicSearchPaths);
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.REPLIT;
  }
}
