package io.socialcomply.platform.integration.storage;

/**
 * Typed configuration for one backend. Each adapter package defines its own record implementing
 * this, produced by {@link io.socialcomply.platform.config.StorageConfigResolver}.
 */
public interface StorageProviderConfig {

  StorageProviderType type();
}
