package io.socialcomply.platform.integration.storage;

/**
 * Contributes one backend to the {@link StorageProviderRegistry}. Each adapter package publishes
 * exactly one of these as a bean; the adapter class itself is only loaded when the factory runs.
 */
public record StorageProviderRegistration(
    StorageProviderType type, StorageProviderFactory factory) {

  public StorageProviderRegistration {
    if (type == null || factory == null) {
      throw new IllegalArgumentException("type and factory must not be null");
    }
  }
}
