package io.socialcomply.platform.integration.storage;

/**
 * The only exception type that crosses the {@link StorageProvider} boundary. Adapters wrap every
 * SDK failure into one of these, tagged with the offending key (when there is one) and the display
 * name of the provider that raised it.
 */
public class StorageException extends RuntimeException {

  private final StorageErrorCode code;
  private final String key;
  private final String provider;

  public StorageException(String message, StorageErrorCode code, String key, String provider) {
    this(message, code, key, provider, null);
  }

  public StorageException(
      String message, StorageErrorCode code, String key, String provider, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.key = key;
    this.provider = provider;
  }

  public StorageErrorCode getCode() {
    return code;
  }

  /** Logical key the failure relates to, or {@code null} for provider-level failures. */
  public String getKey() {
    return key;
  }

  /** Display name of the provider that raised the error, or {@code null} before selection. */
  public String getProvider() {
    return provider;
  }

  @Override
  public String toString() {
    return "StorageException[code="
        + code
        + ", provider="
        + provider
        + ", key="
        + key
        + "]: "
        + getMessage();
  }
}
