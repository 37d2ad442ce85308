package io.socialcomply.platform.integration.storage;

/** Constructs an uninitialized provider from its typed configuration. */
@FunctionalInterface
public interface StorageProviderFactory {

  StorageProvider create(StorageProviderConfig config);
}
