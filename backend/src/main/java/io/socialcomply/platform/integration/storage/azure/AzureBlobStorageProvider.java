package io.socialcomply.platform.integration.storage.azure;

import com.azure.core.http.rest.PagedResponse;
import com.azure.core.util.Context;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobErrorCode;
import com.azure.storage.blob.models.BlobHttpHeaders;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobProperties;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.blob.models.ListBlobsOptions;
import com.azure.storage.blob.models.PublicAccessType;
import com.azure.storage.blob.options.BlobContainerCreateOptions;
import com.azure.storage.blob.options.BlobParallelUploadOptions;
import com.azure.storage.blob.sas.BlobSasPermission;
import com.azure.storage.blob.sas.BlobServiceSasSignatureValues;
import com.azure.storage.common.StorageSharedKeyCredential;
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
import io.socialcomply.platform.integration.storage.StorageException;
import io.socialcomply.platform.integration.storage.StorageKeys;
import io.socialcomply.platform.integration.storage.StorageMetadata;
import io.socialcomply.platform.integration.storage.StorageObject;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import io.socialcomply.platform.integration.storage.UploadOptions;
import io.socialcomply.platform.integration.storage.UploadSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriUtils;

/**
 * Azure Blob Storage implementation of {@link
 * io.socialcomply.platform.integration.storage.StorageProvider}.
 *
 * <p>Visibility is the container: the public container allows anonymous blob reads, the private
 * one does not. Azure has no per-blob ACL, so visibility can only change by copying the blob into
 * the other container. Allow-lists live in an in-process {@link AclOverlay}.
 */
public class AzureBlobStorageProvider extends AbstractStorageProvider {

  private static final Logger log = LoggerFactory.getLogger(AzureBlobStorageProvider.class);

  private static final Duration COPY_POLL_INTERVAL = Duration.ofSeconds(1);

  private final AzureBlobStorageConfig config;
  private final AclOverlay aclOverlay = new AclOverlay();

  private BlobServiceClient serviceClient;
  private StorageSharedKeyCredential credential;
  private BlobContainerClient publicContainer;
  private BlobContainerClient privateContainer;

  public AzureBlobStorageProvider(AzureBlobStorageConfig config) {
    this(config, null, null);
  }

  /** Package-private constructor for testing with a pre-built service client. */
  AzureBlobStorageProvider(
      AzureBlobStorageConfig config,
      BlobServiceClient serviceClient,
      StorageSharedKeyCredential credential) {
    this.config = config;
    this.serviceClient = serviceClient;
    this.credential = credential;
  }

  @Override
  public String name() {
    return "Azure Blob Storage";
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.AZURE_BLOB;
  }

  @Override
  public boolean supportsInPlaceVisibilityChange() {
    return false;
  }

  @Override
  protected void doInitialize() {
    if (serviceClient == null) {
      serviceClient = buildServiceClient();
    }
    publicContainer = serviceClient.getBlobContainerClient(config.publicContainer());
    privateContainer = serviceClient.getBlobContainerClient(config.privateContainer());

    publicContainer.createIfNotExistsWithResponse(
        new BlobContainerCreateOptions().setPublicAccessType(PublicAccessType.BLOB),
        null,
        Context.NONE);
    privateContainer.createIfNotExists();
    if (credential == null) {
      log.warn("No Azure account key configured; signed URLs are unavailable");
    }
  }

  private BlobServiceClient buildServiceClient() {
    if (config.hasConnectionString()) {
      credential = sharedKeyFrom(config.connectionString());
      return new BlobServiceClientBuilder()
          .connectionString(config.connectionString())
          .buildClient();
    }
    if (config.hasAccountKey()) {
      credential = new StorageSharedKeyCredential(config.accountName(), config.accountKey());
      return new BlobServiceClientBuilder()
          .endpoint("https://" + config.accountName() + ".blob.core.windows.net")
          .credential(credential)
          .buildClient();
    }
    throw new StorageException(
        "Azure Blob requires connectionString or accountName+accountKey",
        StorageErrorCode.CONFIGURATION_ERROR,
        null,
        name());
  }

  /** Shared key embedded in the connection string, or {@code null} for SAS connection strings. */
  private static StorageSharedKeyCredential sharedKeyFrom(String connectionString) {
    try {
      return StorageSharedKeyCredential.fromConnectionString(connectionString);
    } catch (IllegalArgumentException e) {
      log.debug("Connection string carries no account key: {}", e.getMessage());
      return null;
    }
  }

  @Override
  protected boolean doHealthCheck() {
    return privateContainer.exists();
  }

  @Override
  public String upload(String key, UploadSource source, UploadOptions options) {
    requireReady(key);
    var effective = options != null ? options : UploadOptions.defaults();
    BlobClient blob = blobFor(key);

    try (InputStream in = source.openStream()) {
      var uploadOptions =
          new BlobParallelUploadOptions(in)
              .setHeaders(new BlobHttpHeaders().setContentType(effective.contentType()));
      if (!effective.metadata().isEmpty()) {
        uploadOptions.setMetadata(effective.metadata());
      }
      blob.uploadWithResponse(uploadOptions, null, Context.NONE);
    } catch (IOException | RuntimeException e) {
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
    BlobClient blob = blobFor(key);
    try {
      StorageMetadata metadata = toMetadata(blob.getProperties());
      return new DownloadResult(blob.openInputStream(), metadata);
    } catch (BlobStorageException e) {
      if (isNotFound(e)) {
        throw notFound(key);
      }
      throw failure(
          "Failed to download: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    } catch (RuntimeException e) {
      throw failure(
          "Failed to download: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
  }

  @Override
  public void delete(String key) {
    requireReady(key);
    try {
      blobFor(key).deleteIfExists();
    } catch (RuntimeException e) {
      throw failure("Failed to delete: " + e.getMessage(), StorageErrorCode.DELETE_FAILED, key, e);
    }
    aclOverlay.remove(key);
    log.info("Deleted object key={}", key);
  }

  @Override
  protected boolean doExists(String key) {
    return blobFor(key).exists();
  }

  @Override
  public StorageMetadata getMetadata(String key) {
    requireReady(key);
    try {
      return toMetadata(blobFor(key).getProperties());
    } catch (BlobStorageException e) {
      if (isNotFound(e)) {
        throw notFound(key);
      }
      throw failure(
          "Failed to read metadata: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    } catch (RuntimeException e) {
      throw failure(
          "Failed to read metadata: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
  }

  @Override
  public String getSignedUrl(String key, SignedUrlOptions options) {
    requireReady(key);
    if (credential == null) {
      throw new StorageException(
          "SAS generation requires accountKey credential",
          StorageErrorCode.CONFIGURATION_ERROR,
          key,
          name());
    }
    var permission =
        switch (options.method()) {
          case GET, HEAD -> new BlobSasPermission().setReadPermission(true);
          case PUT -> new BlobSasPermission().setWritePermission(true).setCreatePermission(true);
          case DELETE -> new BlobSasPermission().setDeletePermission(true);
        };
    var values =
        new BlobServiceSasSignatureValues(
                OffsetDateTime.now().plusSeconds(options.ttlSec()), permission)
            .setContentType(options.enforcedContentType());

    BlobClient blob = blobFor(key);
    try {
      return blob.getBlobUrl() + "?" + blob.generateSas(values);
    } catch (RuntimeException e) {
      throw failure(
          "Failed to generate SAS: " + e.getMessage(),
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
    String blobPrefix = StorageKeys.stripNamespace(prefix);
    int maxResults = options.effectiveMaxResults();

    try {
      var listOptions =
          new ListBlobsOptions()
              .setPrefix(blobPrefix.isEmpty() ? null : blobPrefix)
              .setMaxResultsPerPage(maxResults);
      Iterator<PagedResponse<BlobItem>> pages =
          containerFor(namespace)
              .listBlobs(listOptions, options.cursor(), null)
              .iterableByPage(maxResults)
              .iterator();
      if (!pages.hasNext()) {
        return new ListResult(List.of(), null);
      }
      PagedResponse<BlobItem> page = pages.next();
      List<StorageObject> objects =
          page.getValue().stream()
              .map(
                  item ->
                      new StorageObject(
                          StorageKeys.withNamespace(namespace, item.getName()),
                          new StorageMetadata(
                              item.getProperties().getContentType(),
                              item.getProperties().getContentLength(),
                              item.getProperties().getLastModified() != null
                                  ? item.getProperties().getLastModified().toInstant()
                                  : null,
                              item.getProperties().getETag(),
                              item.getMetadata())))
              .toList();
      log.debug("Listed {} objects under prefix={}", objects.size(), prefix);
      return new ListResult(objects, page.getContinuationToken());
    } catch (RuntimeException e) {
      throw failure(
          "Failed to list: " + e.getMessage(), StorageErrorCode.CONNECTION_ERROR, prefix, e);
    }
  }

  @Override
  public void copy(String sourceKey, String destinationKey) {
    requireReady(sourceKey);
    requireReady(destinationKey);
    BlobClient source = blobFor(sourceKey);
    BlobClient destination = blobFor(destinationKey);

    boolean sourceExists;
    try {
      sourceExists = source.exists();
    } catch (RuntimeException e) {
      throw failure(
          "Failed to copy: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, sourceKey, e);
    }
    if (!sourceExists) {
      throw notFound(sourceKey);
    }

    try {
      destination.beginCopy(source.getBlobUrl(), COPY_POLL_INTERVAL).waitForCompletion();
    } catch (RuntimeException e) {
      throw failure(
          "Failed to copy: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, sourceKey, e);
    }
    aclOverlay.copy(sourceKey, destinationKey);
    log.info("Copied object {} -> {}", sourceKey, destinationKey);
  }

  @Override
  public void setVisibility(String key, ObjectVisibility visibility) {
    requireReady(key);
    Namespace current = StorageKeys.namespaceOf(key, Namespace.PRIVATE);
    Namespace target = Namespace.of(visibility);
    if (current != target) {
      String newKey = StorageKeys.withNamespace(target, StorageKeys.stripNamespace(key));
      throw new StorageException(
          "Azure Blob Storage requires key change for visibility transitions. Use copy('"
              + key
              + "', '"
              + newKey
              + "') then delete('"
              + key
              + "') to change visibility.",
          StorageErrorCode.PERMISSION_DENIED,
          key,
          name());
    }
    aclOverlay.updateVisibility(key, visibility);
  }

  @Override
  public Optional<ObjectAclPolicy> getAclPolicy(String key) {
    requireReady(key);
    return aclOverlay.get(key);
  }

  @Override
  public void setAclPolicy(String key, ObjectAclPolicy policy) {
    requireReady(key);
    aclOverlay.put(key, policy);
    log.info("Set ACL policy of key={} visibility={}", key, policy.visibility());
  }

  @Override
  public Optional<String> getPublicUrl(String key) {
    if (!StorageKeys.isPublicKey(key) || !isInitialized()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          publicContainer.getBlobClient(StorageKeys.stripNamespace(key)).getBlobUrl());
    } catch (RuntimeException e) {
      log.debug("Could not build public URL for key={}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  protected Optional<String> translateBackendReference(String rawPath) {
    if (!isInitialized()) {
      return Optional.empty();
    }
    for (Namespace namespace : Namespace.values()) {
      String base = containerFor(namespace).getBlobContainerUrl() + "/";
      if (rawPath.startsWith(base) && rawPath.length() > base.length()) {
        String blobName = rawPath.substring(base.length());
        int query = blobName.indexOf('?');
        if (query >= 0) {
          blobName = blobName.substring(0, query);
        }
        return Optional.of(
            StorageKeys.withNamespace(
                namespace, UriUtils.decode(blobName, StandardCharsets.UTF_8)));
      }
    }
    return Optional.empty();
  }

  private BlobClient blobFor(String key) {
    return containerFor(StorageKeys.namespaceOf(key, Namespace.PRIVATE))
        .getBlobClient(StorageKeys.stripNamespace(key));
  }

  private BlobContainerClient containerFor(Namespace namespace) {
    return namespace == Namespace.PUBLIC ? publicContainer : privateContainer;
  }

  private static StorageMetadata toMetadata(BlobProperties properties) {
    return new StorageMetadata(
        properties.getContentType(),
        properties.getBlobSize(),
        properties.getLastModified() != null ? properties.getLastModified().toInstant() : null,
        properties.getETag(),
        properties.getMetadata());
  }

  private static boolean isNotFound(BlobStorageException e) {
    return e.getStatusCode() == 404
        || BlobErrorCode.BLOB_NOT_FOUND.equals(e.getErrorCode())
        || BlobErrorCode.CONTAINER_NOT_FOUND.equals(e.getErrorCode());
  }
}
