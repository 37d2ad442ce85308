package io.socialcomply.platform.integration.storage;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle guard and the operations every adapter implements the same way. Subclasses provide
 * the backend calls; this class owns the initialize-once rule, the never-throwing probes and the
 * compositions ({@code streamToResponse}, {@code getUploadUrl}, {@code canAccess}).
 */
public abstract class AbstractStorageProvider implements StorageProvider {

  private static final Logger log = LoggerFactory.getLogger(AbstractStorageProvider.class);

  private volatile boolean initialized;

  @Override
  public final synchronized void initialize() {
    if (initialized) {
      throw new StorageException(
          name() + " storage provider is already initialized",
          StorageErrorCode.CONFIGURATION_ERROR,
          null,
          name());
    }
    try {
      doInitialize();
    } catch (StorageException e) {
      throw e;
    } catch (Exception e) {
      throw new StorageException(
          "Failed to initialize " + name() + " storage provider: " + e.getMessage(),
          StorageErrorCode.CONFIGURATION_ERROR,
          null,
          name(),
          e);
    }
    initialized = true;
    log.info("Storage provider {} initialized", name());
  }

  /** Builds clients and bootstraps buckets. Any exception becomes {@code CONFIGURATION_ERROR}. */
  protected abstract void doInitialize() throws Exception;

  @Override
  public final boolean healthCheck() {
    if (!initialized) {
      return false;
    }
    try {
      return doHealthCheck();
    } catch (Exception e) {
      log.warn("Health check failed for storage provider {}: {}", name(), e.getMessage());
      return false;
    }
  }

  protected abstract boolean doHealthCheck() throws Exception;

  @Override
  public final boolean exists(String key) {
    requireReady(key);
    try {
      return doExists(key);
    } catch (Exception e) {
      log.warn("Existence check failed for key={} on {}: {}", key, name(), e.getMessage());
      return false;
    }
  }

  protected abstract boolean doExists(String key) throws Exception;

  @Override
  public void streamToResponse(String key, ObjectResponseSink sink, DownloadOptions options) {
    try (DownloadResult result = download(key)) {
      StorageMetadata metadata = result.metadata();
      sink.setHeader(
          "Content-Type",
          metadata.contentType() != null
              ? metadata.contentType()
              : UploadOptions.DEFAULT_CONTENT_TYPE);
      if (metadata.size() != null) {
        sink.setHeader("Content-Length", String.valueOf(metadata.size()));
      }
      Integer ttl = options != null ? options.cacheTtlSec() : null;
      sink.setHeader("Cache-Control", ttl != null ? "private, max-age=" + ttl : "no-store");
      OutputStream out = sink.body();
      result.data().transferTo(out);
      out.flush();
    } catch (IOException e) {
      throw failure(
          "Failed to stream object: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
  }

  @Override
  public UploadUrl getUploadUrl(String prefix, long ttlSec) {
    requireInitialized(null);
    String objectKey = StorageKeys.newUploadKey(prefix);
    String url = getSignedUrl(objectKey, SignedUrlOptions.put(ttlSec, null));
    return new UploadUrl(url, objectKey, Instant.now().plusSeconds(ttlSec));
  }

  @Override
  public boolean canAccess(String key, String userId, ObjectPermission permission) {
    requireReady(key);
    ObjectAclPolicy policy = getAclPolicy(key).orElse(null);
    return AccessPolicyEvaluator.canAccess(policy, isStructurallyPublic(key), userId, permission);
  }

  /** Whether the key sits in the public namespace regardless of any recorded policy. */
  protected boolean isStructurallyPublic(String key) {
    return StorageKeys.isPublicKey(key);
  }

  @Override
  public Optional<StorageObject> searchPublicObject(String filePath) {
    requireInitialized(filePath);
    String relative = filePath.startsWith("/") ? filePath.substring(1) : filePath;
    String key = StorageKeys.PUBLIC_PREFIX + StorageKeys.stripNamespace(relative);
    if (!exists(key)) {
      return Optional.empty();
    }
    try {
      return Optional.of(new StorageObject(key, getMetadata(key)));
    } catch (StorageException e) {
      if (e.getCode() == StorageErrorCode.NOT_FOUND) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public String normalizeEntityPath(String rawPath) {
    if (rawPath == null || rawPath.isBlank()) {
      return rawPath;
    }
    return translateBackendReference(rawPath).orElseGet(() -> StorageKeys.sanitize(rawPath));
  }

  /** Logical key for a backend URL or path this adapter recognizes. */
  protected Optional<String> translateBackendReference(String rawPath) {
    return Optional.empty();
  }

  @Override
  public void close() {}

  protected final boolean isInitialized() {
    return initialized;
  }

  protected final void requireInitialized(String key) {
    if (!initialized) {
      throw new StorageException(
          name() + " storage provider is not initialized. Call initialize() first.",
          StorageErrorCode.CONFIGURATION_ERROR,
          key,
          name());
    }
  }

  /** Initialization check followed by key validation. */
  protected final void requireReady(String key) {
    requireInitialized(key);
    StorageKeys.validate(key, name());
  }

  protected final StorageException failure(
      String message, StorageErrorCode code, String key, Throwable cause) {
    return new StorageException(message, code, key, name(), cause);
  }

  protected final StorageException notFound(String key) {
    return new StorageException(
        "Object not found: " + key, StorageErrorCode.NOT_FOUND, key, name());
  }
}
