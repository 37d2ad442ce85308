package io.socialcomply.platform.integration.storage.gcs;

import io.socialcomply.platform.integration.storage.StorageProviderRegistration;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GcsStorageRegistration {

  @Bean
  StorageProviderRegistration gcsStorageProviderRegistration() {
    return new StorageProviderRegistration(
        StorageProviderType.GCS, config -> new GcsStorageProvider((GcsStorageConfig) config));
  }
}
