package io.socialcomply.platform.integration.storage;

import java.util.Optional;

/**
 * Abstraction for object storage operations. Domain services inject this interface instead of
 * vendor-specific clients (S3Client, BlobServiceClient, Storage).
 *
 * <p>System-wide: exactly one provider is active per process, chosen at startup from {@code
 * storage.provider}. Every failure crossing this interface is a {@link StorageException}.
 */
public interface StorageProvider extends AutoCloseable {

  long DEFAULT_UPLOAD_URL_TTL_SEC = 900;

  /** Display name used in errors and logs. */
  String name();

  StorageProviderType type();

  /** Whether visibility can change without moving the object to another key. */
  boolean supportsInPlaceVisibilityChange();

  /** Build clients and create buckets/containers/directories if absent. Called exactly once. */
  void initialize();

  /** Cheap read-only probe. Never throws. */
  boolean healthCheck();

  /** Write the object in a single logical backend write and return its key. */
  String upload(String key, UploadSource source, UploadOptions options);

  default String upload(String key, byte[] content, UploadOptions options) {
    return upload(key, UploadSource.of(content), options);
  }

  /** Open the object for reading. The caller owns the returned stream. */
  DownloadResult download(String key);

  /** Write headers and stream the object body to {@code sink} without buffering it. */
  void streamToResponse(String key, ObjectResponseSink sink, DownloadOptions options);

  /** Delete the object. Deleting a missing key is not an error. */
  void delete(String key);

  boolean exists(String key);

  StorageMetadata getMetadata(String key);

  /** Generate a time-limited URL authorizing {@code options.method()} on the object. */
  String getSignedUrl(String key, SignedUrlOptions options);

  /** Generate a presigned PUT for a fresh private key under {@code prefix}. */
  UploadUrl getUploadUrl(String prefix, long ttlSec);

  default UploadUrl getUploadUrl(String prefix) {
    return getUploadUrl(prefix, DEFAULT_UPLOAD_URL_TTL_SEC);
  }

  /** One page of objects under the prefix. Keys come back with their namespace prefix. */
  ListResult list(ListOptions options);

  /** Server-side copy. The source's ACL policy follows the object. */
  void copy(String sourceKey, String destinationKey);

  void setVisibility(String key, ObjectVisibility visibility);

  Optional<ObjectAclPolicy> getAclPolicy(String key);

  void setAclPolicy(String key, ObjectAclPolicy policy);

  boolean canAccess(String key, String userId, ObjectPermission permission);

  /** Stable unsigned URL for a public object; empty for private objects. Never throws. */
  Optional<String> getPublicUrl(String key);

  /** Translate a backend URL or path into a logical key. */
  String normalizeEntityPath(String rawPath);

  /** Find {@code filePath} in the public namespace. */
  Optional<StorageObject> searchPublicObject(String filePath);

  /** Release SDK clients. */
  @Override
  void close();
}
