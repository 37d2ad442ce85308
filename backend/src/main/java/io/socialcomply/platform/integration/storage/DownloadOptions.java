package io.socialcomply.platform.integration.storage;

/**
 * @param cacheTtlSec client cache lifetime for {@code Cache-Control}; {@code null} means the
 *     response must not be stored
 */
public record DownloadOptions(Integer cacheTtlSec) {

  public static DownloadOptions noStore() {
    return new DownloadOptions(null);
  }

  public static DownloadOptions cacheFor(int seconds) {
    return new DownloadOptions(seconds);
  }
}
