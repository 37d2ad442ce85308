package io.socialcomply.platform.integration.storage.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.socialcomply.platform.integration.storage.StorageProviderRegistration;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LocalStorageRegistration {

  @Bean
  StorageProviderRegistration localStorageProviderRegistration(ObjectMapper objectMapper) {
    return new StorageProviderRegistration(
        StorageProviderType.LOCAL,
        config -> new LocalStorageProvider((LocalStorageConfig) config, objectMapper));
  }
}
