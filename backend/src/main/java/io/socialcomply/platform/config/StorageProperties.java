package io.socialcomply.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Raw {@code storage.*} settings as bound from {@code application.yml}. Anything left unset is
 * {@code null}; {@link StorageConfigResolver} applies defaults and validation.
 *
 * @param provider backend slug ({@code local}, {@code s3}, {@code azure}, {@code gcs}, {@code
 *     replit})
 * @param publicBucket generic override for the active backend's public bucket or container
 * @param privateBucket generic override for the active backend's private bucket or container
 */
@ConfigurationProperties("storage")
public record StorageProperties(
    String provider,
    String publicBucket,
    String privateBucket,
    Local local,
    S3 s3,
    Azure azure,
    Gcs gcs,
    Replit replit) {

  public record Local(String basePath, String publicUrl, String signingSecret) {}

  public record S3(
      String region,
      String accessKeyId,
      String secretAccessKey,
      String endpoint,
      Boolean forcePathStyle,
      String publicBucket,
      String privateBucket) {}

  public record Azure(
      String accountName,
      String accountKey,
      String connectionString,
      String publicContainer,
      String privateContainer) {}

  public record Gcs(
      String projectId, String keyFilename, String publicBucket, String privateBucket) {}

  /**
   * @param publicSearchPaths comma-separated {@code /bucket/dir} roots
   */
  public record Replit(
      String sidecarEndpoint,
      String publicSearchPaths,
      String privateObjectDir,
      String publicUrl) {}
}
