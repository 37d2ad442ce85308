package io.socialcomply.platform.integration.storage.gcs;

import com.google.api.gax.paging.Page;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.BaseServiceException;
import com.google.cloud.storage.Acl;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.HttpMethod;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import io.socialcomply.platform.integration.storage.AbstractStorageProvider;
import io.socialcomply.platform.integration.storage.AclOverlay;
import io.socialcomply.platform.integration.storage.DownloadResult;
import io.socialcomply.platform.integration.storage.ListOptions;
import io.socialcomply.platform.integration.storage.ListResult;
import io.socialcomply.platform.integration.storage.Namespace;
import io.socialcomply.platform.integration.storage.ObjectAclPolicy;
import io.socialcomply.platform.integration.storage.ObjectVisibility;
import io.socialcomply.platform.integration.storage.SignedUrlOptions;
import io.socialcomply.platform.integration.storage.StorageErrorCode;
import io.socialcomply.platform.integration.storage.StorageKeys;
import io.socialcomply.platform.integration.storage.StorageMetadata;
import io.socialcomply.platform.integration.storage.StorageObject;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import io.socialcomply.platform.integration.storage.UploadOptions;
import io.socialcomply.platform.integration.storage.UploadSource;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Google Cloud Storage implementation of {@link
 * io.socialcomply.platform.integration.storage.StorageProvider}. Visibility is the {@code allUsers}
 * READER object ACL, so buckets must use fine-grained access control.
 */
public class GcsStorageProvider extends AbstractStorageProvider {

  private static final Logger log = LoggerFactory.getLogger(GcsStorageProvider.class);

  private final GcsStorageConfig config;
  private final AclOverlay aclOverlay = new AclOverlay();

  private Storage storage;

  public GcsStorageProvider(GcsStorageConfig config) {
    this(config, null);
  }

  /** Package-private constructor for testing with a mocked client. */
  GcsStorageProvider(GcsStorageConfig config, Storage storage) {
    this.config = config;
    this.storage = storage;
  }

  @Override
  public String name() {
    return "Google Cloud Storage";
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.GCS;
  }

  @Override
  public boolean supportsInPlaceVisibilityChange() {
    return true;
  }

  @Override
  protected void doInitialize() throws IOException {
    if (storage == null) {
      storage = buildClient();
    }
    ensureBucket(config.publicBucket());
    ensureBucket(config.privateBucket());
  }

  private Storage buildClient() throws IOException {
    var builder = StorageOptions.newBuilder();
    if (config.projectId() != null && !config.projectId().isBlank()) {
      builder.setProjectId(config.projectId());
    }
    if (config.keyFilename() != null && !config.keyFilename().isBlank()) {
      try (InputStream keyFile = new FileInputStream(config.keyFilename())) {
        builder.setCredentials(GoogleCredentials.fromStream(keyFile));
      }
    }
    return builder.build().getService();
  }

  private void ensureBucket(String bucket) {
    if (storage.get(bucket) == null) {
      storage.create(BucketInfo.of(bucket));
      log.info("Created GCS bucket {}", bucket);
    }
  }

  @Override
  protected boolean doHealthCheck() {
    return storage.get(config.privateBucket()) != null;
  }

  @Override
  public String upload(String key, UploadSource source, UploadOptions options) {
    requireReady(key);
    var effective = options != null ? options : UploadOptions.defaults();
    var blobInfo =
        BlobInfo.newBuilder(blobId(key))
            .setContentType(effective.contentType())
            .setMetadata(effective.metadata().isEmpty() ? null : effective.metadata())
            .build();
    boolean publicRead =
        effective.isPublic() || StorageKeys.namespaceOf(key, Namespace.PRIVATE) == Namespace.PUBLIC;

    try (InputStream in = source.openStream()) {
      if (publicRead) {
        storage.createFrom(
            blobInfo, in, Storage.BlobWriteOption.predefinedAcl(Storage.PredefinedAcl.PUBLIC_READ));
      } else {
        storage.createFrom(blobInfo, in);
      }
    } catch (IOException | BaseServiceException e) {
      throw failure("Failed to upload: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, key, e);
    }
    // The replaced object's allow-lists do not carry over to the new one.
    aclOverlay.remove(key);
    log.info("Uploaded object key={} contentType={}", key, effective.contentType());
    return key;
  }

  @Override
  public DownloadResult download(String key) {
    requireReady(key);
    try {
      Blob blob = storage.get(blobId(key));
      if (blob == null) {
        throw notFound(key);
      }
      InputStream data = Channels.newInputStream(storage.reader(blob.getBlobId()));
      return new DownloadResult(data, GcsBlobs.toMetadata(blob));
    } catch (BaseServiceException e) {
      throw failure(
          "Failed to download: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
  }

  @Override
  public void delete(String key) {
    requireReady(key);
    try {
      storage.delete(blobId(key));
    } catch (BaseServiceException e) {
      throw failure("Failed to delete: " + e.getMessage(), StorageErrorCode.DELETE_FAILED, key, e);
    }
    aclOverlay.remove(key);
    log.info("Deleted object key={}", key);
  }

  @Override
  protected boolean doExists(String key) {
    return storage.get(blobId(key)) != null;
  }

  @Override
  public StorageMetadata getMetadata(String key) {
    requireReady(key);
    Blob blob;
    try {
      blob = storage.get(blobId(key));
    } catch (BaseServiceException e) {
      throw failure(
          "Failed to read metadata: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
    if (blob == null) {
      throw notFound(key);
    }
    return GcsBlobs.toMetadata(blob);
  }

  @Override
  public String getSignedUrl(String key, SignedUrlOptions options) {
    requireReady(key);
    var blobInfo =
        BlobInfo.newBuilder(blobId(key)).setContentType(options.enforcedContentType()).build();
    var signOptions = new ArrayList<Storage.SignUrlOption>();
    signOptions.add(Storage.SignUrlOption.withV4Signature());
    signOptions.add(Storage.SignUrlOption.httpMethod(HttpMethod.valueOf(options.method().name())));
    if (options.enforcedContentType() != null) {
      signOptions.add(Storage.SignUrlOption.withContentType());
    }
    try {
      return storage
          .signUrl(
              blobInfo,
              options.ttlSec(),
              TimeUnit.SECONDS,
              signOptions.toArray(new Storage.SignUrlOption[0]))
          .toString();
    } catch (IllegalStateException | IllegalArgumentException | BaseServiceException e) {
      throw failure(
          "V4 signing requires service-account credentials: " + e.getMessage(),
          StorageErrorCode.CONFIGURATION_ERROR,
          key,
          e);
    }
  }

  @Override
  public ListResult list(ListOptions options) {
    String prefix = options.effectivePrefix();
    requireInitialized(prefix);
    Namespace namespace = StorageKeys.namespaceOf(prefix, Namespace.PRIVATE);
    String objectPrefix = StorageKeys.stripNamespace(prefix);

    var listOptions = new ArrayList<Storage.BlobListOption>();
    listOptions.add(Storage.BlobListOption.pageSize(options.effectiveMaxResults()));
    if (!objectPrefix.isEmpty()) {
      listOptions.add(Storage.BlobListOption.prefix(objectPrefix));
    }
    if (options.cursor() != null) {
      listOptions.add(Storage.BlobListOption.pageToken(options.cursor()));
    }

    try {
      Page<Blob> page =
          storage.list(bucketFor(namespace), listOptions.toArray(new Storage.BlobListOption[0]));
      var objects = new ArrayList<StorageObject>();
      for (Blob blob : page.getValues()) {
        objects.add(
            new StorageObject(
                StorageKeys.withNamespace(namespace, blob.getName()), GcsBlobs.toMetadata(blob)));
      }
      log.debug("Listed {} objects under prefix={}", objects.size(), prefix);
      return new ListResult(objects, page.getNextPageToken());
    } catch (BaseServiceException e) {
      throw failure(
          "Failed to list: " + e.getMessage(), StorageErrorCode.CONNECTION_ERROR, prefix, e);
    }
  }

  @Override
  public void copy(String sourceKey, String destinationKey) {
    requireReady(sourceKey);
    requireReady(destinationKey);
    try {
      storage.copy(Storage.CopyRequest.of(blobId(sourceKey), blobId(destinationKey))).getResult();
    } catch (BaseServiceException e) {
      if (e.getCode() == 404) {
        throw notFound(sourceKey);
      }
      throw failure(
          "Failed to copy: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, sourceKey, e);
    }
    if (StorageKeys.namespaceOf(destinationKey, Namespace.PRIVATE) == Namespace.PUBLIC) {
      applyAcl(destinationKey, ObjectVisibility.PUBLIC);
    }
    aclOverlay.copy(sourceKey, destinationKey);
    log.info("Copied object {} -> {}", sourceKey, destinationKey);
  }

  @Override
  public void setVisibility(String key, ObjectVisibility visibility) {
    requireReady(key);
    applyAcl(key, visibility);
    aclOverlay.updateVisibility(key, visibility);
    log.info("Set visibility of key={} to {}", key, visibility);
  }

  private void applyAcl(String key, ObjectVisibility visibility) {
    try {
      if (visibility == ObjectVisibility.PUBLIC) {
        storage.createAcl(blobId(key), Acl.of(Acl.User.ofAllUsers(), Acl.Role.READER));
      } else {
        storage.deleteAcl(blobId(key), Acl.User.ofAllUsers());
      }
    } catch (BaseServiceException e) {
      if (e.getCode() == 404) {
        throw notFound(key);
      }
      throw failure(
          "Failed to set visibility: " + e.getMessage(),
          StorageErrorCode.PERMISSION_DENIED,
          key,
          e);
    }
  }

  @Override
  public Optional<ObjectAclPolicy> getAclPolicy(String key) {
    requireReady(key);
    return aclOverlay.get(key);
  }

  @Override
  public void setAclPolicy(String key, ObjectAclPolicy policy) {
    requireReady(key);
    applyAcl(key, policy.visibility());
    aclOverlay.put(key, policy);
    log.info("Set ACL policy of key={} visibility={}", key, policy.visibility());
  }

  @Override
  public Optional<String> getPublicUrl(String key) {
    if (!StorageKeys.isPublicKey(key)) {
      return Optional.empty();
    }
    return Optional.of(
        GcsBlobs.PUBLIC_HOST + config.publicBucket() + "/" + StorageKeys.stripNamespace(key));
  }

  @Override
  protected Optional<String> translateBackendReference(String rawPath) {
    for (Namespace namespace : Namespace.values()) {
      String bucket = bucketFor(namespace);
      for (String base : List.of(GcsBlobs.PUBLIC_HOST + bucket + "/", "gs://" + bucket + "/")) {
        if (rawPath.startsWith(base) && rawPath.length() > base.length()) {
          return Optional.of(
              StorageKeys.withNamespace(namespace, rawPath.substring(base.length())));
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public void close() {
    if (storage == null) {
      return;
    }
    try {
      storage.close();
    } catch (Exception e) {
      log.warn("Failed to close GCS client: {}", e.getMessage());
    }
  }

  private BlobId blobId(String key) {
    return BlobId.of(
        bucketFor(StorageKeys.namespaceOf(key, Namespace.PRIVATE)),
        StorageKeys.stripNamespace(key));
  }

  private String bucketFor(Namespace namespace) {
    return namespace == Namespace.PUBLIC ? config.publicBucket() : config.privateBucket();
  }
}
