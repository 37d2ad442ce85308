package io.socialcomply.platform.integration.storage;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Logical key rules shared by every adapter: namespace detection, prefix stripping and
 * re-prefixing, validation and upload-key generation.
 */
public final class StorageKeys {

  public static final String PRIVATE_PREFIX = Namespace.PRIVATE.prefix();
  public static final String PUBLIC_PREFIX = Namespace.PUBLIC.prefix();

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-z0-9\\-_/.]");
  private static final Pattern REPEATED_SLASHES = Pattern.compile("/+");
  private static final Pattern EDGE_SLASHES = Pattern.compile("^/+|/+$");

  private StorageKeys() {}

  /** Namespace of {@code key}, falling back to {@code unprefixedDefault} for unprefixed keys. */
  public static Namespace namespaceOf(String key, Namespace unprefixedDefault) {
    Namespace namespace = Namespace.fromPrefix(key);
    return namespace != null ? namespace : unprefixedDefault;
  }

  public static boolean isPublicKey(String key) {
    return key != null && key.startsWith(PUBLIC_PREFIX);
  }

  public static boolean isPrivateKey(String key) {
    return key != null && key.startsWith(PRIVATE_PREFIX);
  }

  /** Backend-native object name: the key without its namespace prefix. */
  public static String stripNamespace(String key) {
    Namespace namespace = Namespace.fromPrefix(key);
    return namespace == null ? key : key.substring(namespace.prefix().length());
  }

  /** Logical key for a backend-native object name found in {@code namespace}'s bucket. */
  public static String withNamespace(Namespace namespace, String objectName) {
    return namespace.prefix() + objectName;
  }

  /**
   * Rejects keys that are empty or could escape their namespace.
   *
   * @throws StorageException {@code INVALID_KEY}
   */
  public static void validate(String key, String provider) {
    if (key == null || key.isBlank()) {
      throw new StorageException(
          "Storage key must not be empty", StorageErrorCode.INVALID_KEY, key, provider);
    }
    if (key.indexOf('\\') >= 0 || key.indexOf('\0') >= 0) {
      throw new StorageException(
          "Storage key contains illegal characters: " + key,
          StorageErrorCode.INVALID_KEY,
          key,
          provider);
    }
    for (String segment : key.split("/", -1)) {
      if (segment.equals("..")) {
        throw new StorageException(
            "Storage key must not contain '..' segments: " + key,
            StorageErrorCode.INVALID_KEY,
            key,
            provider);
      }
    }
  }

  /**
   * Fresh private key for a direct upload: {@code .private/[prefix/]<uuid>}. UUID v4 is drawn from
   * {@link java.security.SecureRandom}, so keys are not guessable.
   */
  public static String newUploadKey(String prefix) {
    String objectId = UUID.randomUUID().toString();
    if (prefix == null || prefix.isBlank()) {
      return PRIVATE_PREFIX + objectId;
    }
    String trimmed = EDGE_SLASHES.matcher(stripNamespace(prefix.trim())).replaceAll("");
    if (trimmed.isEmpty()) {
      return PRIVATE_PREFIX + objectId;
    }
    return PRIVATE_PREFIX + trimmed + "/" + objectId;
  }

  /** Lowercases and replaces anything outside {@code [a-z0-9-_/.]}; collapses and trims slashes. */
  public static String sanitize(String rawPath) {
    String lowered = rawPath.toLowerCase(Locale.ROOT);
    String replaced = UNSAFE_CHARS.matcher(lowered).replaceAll("-");
    String collapsed = REPEATED_SLASHES.matcher(replaced).replaceAll("/");
    return EDGE_SLASHES.matcher(collapsed).replaceAll("");
  }
}
