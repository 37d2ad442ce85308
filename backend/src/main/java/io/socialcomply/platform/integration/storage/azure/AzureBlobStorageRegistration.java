package io.socialcomply.platform.integration.storage.azure;

import io.socialcomply.platform.integration.storage.StorageProviderRegistration;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AzureBlobStorageRegistration {

  @Bean
  StorageProviderRegistration azureBlobStorageProviderRegistration() {
    return new StorageProviderRegistration(
        StorageProviderType.AZURE_BLOB,
        config -> new AzureBlobStorageProvider((AzureBlobStorageConfig) config));
  }
}
