package io.socialcomply.platform.config;

import io.socialcomply.platform.integration.storage.StorageProvider;
import io.socialcomply.platform.integration.storage.StorageProviderRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the active {@link StorageProvider}. It is built, initialized and health-checked once at
 * startup; any failure aborts the context.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

  @Bean(destroyMethod = "close")
  StorageProvider storageProvider(
      StorageProviderRegistry registry,
      StorageConfigResolver resolver,
      StorageProperties properties) {
    return registry.activate(resolver.resolve(properties));
  }
}
