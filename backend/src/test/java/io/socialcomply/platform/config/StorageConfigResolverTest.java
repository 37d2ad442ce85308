package io.socialcomply.platform.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.socialcomply.platform.integration.storage.StorageErrorCode;
import io.socialcomply.platform.integration.storage.StorageException;
import io.socialcomply.platform.integration.storage.azure.AzureBlobStorageConfig;
import io.socialcomply.platform.integration.storage.gcs.GcsStorageConfig;
import io.socialcomply.platform.integration.storage.local.LocalStorageConfig;
import io.socialcomply.platform.integration.storage.replit.ReplitStorageConfig;
import io.socialcomply.platform.integration.storage.s3.S3StorageConfig;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class StorageConfigResolverTest {

  private final StorageConfigResolver resolver = new StorageConfigResolver();

  private static StorageProperties properties(String provider) {
    return new StorageProperties(provider, null, null, null, null, null, null, null);
  }

  @Test
  void resolve_noProvider_defaultsToLocalUnderDataDirectory() {
    var config = (LocalStorageConfig) resolver.resolve(properties(null));

    assertThat(config.basePath()).isEqualTo(Path.of("./data/storage"));
    assertThat(config.publicBucket()).isEqualTo("public");
    assertThat(config.privateBucket()).isEqualTo(".private");
    assertThat(config.publicUrl()).isNull();
  }

  @Test
  void resolve_providerSlug_isCaseInsensitiveAndAcceptsAlias() {
    var props =
        new StorageProperties(
            "AZURE",
            null,
            null,
            null,
            null,
            new StorageProperties.Azure("acct", "a2V5", null, null, null),
            null,
            null);

    assertThat(resolver.resolve(props)).isInstanceOf(AzureBlobStorageConfig.class);
  }

  @Test
  void resolve_unknownProvider_isConfigurationError() {
    assertThatThrownBy(() -> resolver.resolve(properties("dropbox")))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("dropbox")
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.CONFIGURATION_ERROR);
  }

  @Test
  void resolve_s3Defaults_useVirtualHostedAddressingInUsEast1() {
    var config = (S3StorageConfig) resolver.resolve(properties("s3"));

    assertThat(config.region()).isEqualTo("us-east-1");
    assertThat(config.endpoint()).isNull();
    assertThat(config.forcePathStyle()).isFalse();
    assertThat(config.publicBucket()).isEqualTo("public");
    assertThat(config.privateBucket()).isEqualTo("private");
  }

  @Test
  void resolve_s3CustomEndpoint_defaultsToPathStyle() {
    var props =
        new StorageProperties(
            "s3",
            null,
            null,
            null,
            new StorageProperties.S3(
                "eu-west-1", "key", "secret", "http://minio:9000", null, null, null),
            null,
            null,
            null);

    var config = (S3StorageConfig) resolver.resolve(props);

    assertThat(config.endpoint()).isEqualTo("http://minio:9000");
    assertThat(config.forcePathStyle()).isTrue();
    assertThat(config.region()).isEqualTo("eu-west-1");
  }

  @Test
  void resolve_s3ExplicitPathStyleFlag_winsOverEndpointDefault() {
    var props =
        new StorageProperties(
            "s3",
            null,
            null,
            null,
            new StorageProperties.S3(null, null, null, "http://minio:9000", false, null, null),
            null,
            null,
            null);

    assertThat(((S3StorageConfig) resolver.resolve(props)).forcePathStyle()).isFalse();
  }

  @Test
  void resolve_bucketNames_preferProviderSpecificThenGenericThenDefault() {
    var props =
        new StorageProperties(
            "s3",
            "shared-public",
            "shared-private",
            null,
            new StorageProperties.S3(null, null, null, null, null, "s3-public", " "),
            null,
            null,
            null);

    var config = (S3StorageConfig) resolver.resolve(props);

    assertThat(config.publicBucket()).isEqualTo("s3-public");
    assertThat(config.privateBucket()).isEqualTo("shared-private");
  }

  @Test
  void resolve_gcs_fallsBackToGenericBuckets() {
    var props =
        new StorageProperties(
            "gcs",
            "assets",
            null,
            null,
            null,
            null,
            new StorageProperties.Gcs("demo", "/secrets/key.json", null, null),
            null);

    var config = (GcsStorageConfig) resolver.resolve(props);

    assertThat(config.projectId()).isEqualTo("demo");
    assertThat(config.keyFilename()).isEqualTo("/secrets/key.json");
    assertThat(config.publicBucket()).isEqualTo("assets");
    assertThat(config.privateBucket()).isEqualTo("private");
  }

  @Test
  void resolve_azureWithoutCredentials_isConfigurationError() {
    var props =
        new StorageProperties(
            "azure_blob",
            null,
            null,
            null,
            null,
            new StorageProperties.Azure("acct", null, null, null, null),
            null,
            null);

    assertThatThrownBy(() -> resolver.resolve(props))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("AZURE_STORAGE_CONNECTION_STRING")
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.CONFIGURATION_ERROR);
  }

  @Test
  void resolve_azureConnectionString_isEnough() {
    var props =
        new StorageProperties(
            "azure_blob",
            null,
            null,
            null,
            null,
            new StorageProperties.Azure(null, null, "UseDevelopmentStorage=true", "pub", "priv"),
            null,
            null);

    var config = (AzureBlobStorageConfig) resolver.resolve(props);

    assertThat(config.connectionString()).isEqualTo("UseDevelopmentStorage=true");
    assertThat(config.publicContainer()).isEqualTo("pub");
    assertThat(config.privateContainer()).isEqualTo("priv");
  }

  @Test
  void resolve_replit_splitsSearchPathsAndDefaultsSidecar() {
    var props =
        new StorageProperties(
            "replit",
            null,
            null,
            null,
            null,
            null,
            null,
            new StorageProperties.Replit(
                null, " /bucket/public , /bucket/assets,,/bucket/public ", "/bucket/.private", ""));

    var config = (ReplitStorageConfig) resolver.resolve(props);

    assertThat(config.sidecarEndpoint()).isEqualTo("http://127.0.0.1:1106");
    assertThat(config.publicSearchPaths()).containsExactly("/bucket/public", "/bucket/assets");
    assertThat(config.privateObjectDir()).isEqualTo("/bucket/.private");
    assertThat(config.publicUrl()).isNull();
  }

  @Test
  void resolve_replitWithoutPrivateDir_isConfigurationError() {
    assertThatThrownBy(() -> resolver.resolve(properties("replit")))
        .isInstanceOf(StorageException.class)
        .hasMessage("Replit object storage requires PRIVATE_OBJECT_DIR");
  }

  @Test
  void splitSearchPaths_blank_isEmpty() {
    assertThat(StorageConfigResolver.splitSearchPaths(null)).isEmpty();
    assertThat(StorageConfigResolver.splitSearchPaths("  ")).isEmpty();
  }
}
