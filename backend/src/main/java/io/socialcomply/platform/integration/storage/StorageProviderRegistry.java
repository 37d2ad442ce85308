package io.socialcomply.platform.integration.storage;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StorageProviderRegistry {

  private static final Logger log = LoggerFactory.getLogger(StorageProviderRegistry.class);

  // Built at startup: provider type -> factory
  private final Map<StorageProviderType, StorageProviderFactory> factories =
      new EnumMap<>(StorageProviderType.class);

  private final Map<StorageProviderType, ProviderLifecycleState> states =
      new ConcurrentHashMap<>();

  private volatile StorageProvider activeProvider;

  public StorageProviderRegistry(List<StorageProviderRegistration> registrations) {
    // Fail fast if two adapter packages register the same provider type.
    for (StorageProviderRegistration registration : registrations) {
      var existing = factories.putIfAbsent(registration.type(), registration.factory());
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate StorageProviderRegistration: type="
                + registration.type().getSlug()
                + " registered by both "
                + existing.getClass().getName()
                + " and "
                + registration.factory().getClass().getName());
      }
      states.put(registration.type(), ProviderLifecycleState.REGISTERED);
    }
  }

  /** Lists registered provider types. */
  public List<StorageProviderType> availableProviders() {
    return List.copyOf(factories.keySet());
  }

  public ProviderLifecycleState lifecycleState(StorageProviderType type) {
    return states.getOrDefault(type, ProviderLifecycleState.UNREGISTERED);
  }

  /**
   * Construct, initialize and health-check a provider. A provider that fails either step is closed
   * before the error propagates.
   *
   * @throws StorageException {@code CONFIGURATION_ERROR} for an unregistered type or a failed
   *     initialization, {@code PROVIDER_UNAVAILABLE} when the health check fails
   */
  public StorageProvider create(StorageProviderConfig config) {
    var factory = factories.get(config.type());
    if (factory == null) {
      throw new StorageException(
          "Storage provider type '"
              + config.type().getSlug()
              + "' is not registered. Available providers: "
              + factories.keySet().stream()
                  .map(StorageProviderType::getSlug)
                  .collect(Collectors.joining(", ")),
          StorageErrorCode.CONFIGURATION_ERROR,
          null,
          config.type().getSlug());
    }

    StorageProvider provider = factory.create(config);
    try {
      provider.initialize();
      states.put(config.type(), ProviderLifecycleState.CONSTRUCTED);

      if (!provider.healthCheck()) {
        throw new StorageException(
            "Storage provider '" + provider.name() + "' failed health check",
            StorageErrorCode.PROVIDER_UNAVAILABLE,
            null,
            provider.name());
      }
    } catch (RuntimeException e) {
      closeQuietly(provider);
      throw e;
    }
    states.put(config.type(), ProviderLifecycleState.HEALTHY);
    return provider;
  }

  /** {@link #create} and mark the result as the single process-wide provider. */
  public synchronized StorageProvider activate(StorageProviderConfig config) {
    if (activeProvider != null) {
      throw new StorageException(
          "A storage provider is already active: " + activeProvider.name(),
          StorageErrorCode.CONFIGURATION_ERROR,
          null,
          activeProvider.name());
    }
    StorageProvider provider = create(config);
    activeProvider = provider;
    states.put(config.type(), ProviderLifecycleState.ACTIVE);
    log.info("Initialized {} storage provider", provider.name());
    return provider;
  }

  public Optional<StorageProvider> activeProvider() {
    return Optional.ofNullable(activeProvider);
  }

  private static void closeQuietly(StorageProvider provider) {
    try {
      provider.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close storage provider {}: {}", provider.name(), e.getMessage());
    }
  }
}
