package io.socialcomply.platform.integration.storage;

/**
 * @param method HTTP method the URL authorizes
 * @param ttlSec lifetime of the URL in seconds
 * @param contentType required request {@code Content-Type}; honoured for {@code PUT} only
 */
public record SignedUrlOptions(SignedUrlMethod method, long ttlSec, String contentType) {

  public SignedUrlOptions {
    if (method == null) {
      throw new IllegalArgumentException("method must not be null");
    }
    if (ttlSec <= 0) {
      throw new IllegalArgumentException("ttlSec must be positive");
    }
  }

  public static SignedUrlOptions get(long ttlSec) {
    return new SignedUrlOptions(SignedUrlMethod.GET, ttlSec, null);
  }

  public static SignedUrlOptions put(long ttlSec, String contentType) {
    return new SignedUrlOptions(SignedUrlMethod.PUT, ttlSec, contentType);
  }

  /** Content type to bind into the signature, or {@code null} when not applicable. */
  public String enforcedContentType() {
    return method == SignedUrlMethod.PUT && contentType != null && !contentType.isBlank()
        ? contentType
        : null;
  }
}
