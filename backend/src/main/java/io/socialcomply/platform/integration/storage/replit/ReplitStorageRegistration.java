package io.socialcomply.platform.integration.storage.replit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.socialcomply.platform.integration.storage.StorageProviderRegistration;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReplitStorageRegistration {

  @Bean
  StorageProviderRegistration replitStorageProviderRegistration(ObjectMapper objectMapper) {
    return new StorageProviderRegistration(
        StorageProviderType.REPLIT,
        config -> new ReplitStorageProvider((ReplitStorageConfig) config, objectMapper));
  }
}
