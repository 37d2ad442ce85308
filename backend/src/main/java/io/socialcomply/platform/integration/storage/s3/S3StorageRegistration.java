package io.socialcomply.platform.integration.storage.s3;

import io.socialcomply.platform.integration.storage.StorageProviderRegistration;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class S3StorageRegistration {

  @Bean
  StorageProviderRegistration s3StorageProviderRegistration() {
    return new StorageProviderRegistration(
        StorageProviderType.S3, config -> new S3StorageProvider((S3StorageConfig) config));
  }
}
