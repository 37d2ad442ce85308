package io.socialcomply.platform.integration.storage.replit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.gax.paging.Page;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.BaseServiceException;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
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
import io.socialcomply.platform.integration.storage.gcs.GcsBlobs;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.channels.Channels;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Object storage behind a local credential sidecar. Objects live in Cloud Storage buckets reached
 * with short-lived federated credentials; the sidecar also signs URLs.
 *
 * <p>Keys map onto {@code /bucket/object} paths: {@code .private/} and unprefixed keys go under
 * the private object directory, {@code public/} keys under the first public search path, and keys
 * starting with {@code /} are used as absolute paths. ACL policies are JSON in the {@code
 * custom:aclPolicy} object metadata entry.
 */
public class ReplitStorageProvider extends AbstractStorageProvider {

  private static final Logger log = LoggerFactory.getLogger(ReplitStorageProvider.class);

  static final String SIGNED_URL_PATH = "/object-storage/signed-object-url";
  private static final Duration SIDECAR_TIMEOUT = Duration.ofSeconds(5);
  private static final int POLICY_WRITE_ATTEMPTS = 5;
  private static final int PRECONDITION_FAILED = 412;

  private final ReplitStorageConfig config;
  private final ObjectMapper objectMapper;
  private final String endpoint;

  private Storage storage;
  private RestClient restClient;

  public ReplitStorageProvider(ReplitStorageConfig config, ObjectMapper objectMapper) {
    this(config, objectMapper, null, null);
  }

  /** Package-private constructor for testing with a mocked client and sidecar. */
  ReplitStorageProvider(
      ReplitStorageConfig config,
      ObjectMapper objectMapper,
      Storage storage,
      RestClient restClient) {
    this.config = config;
    this.objectMapper = objectMapper;
    this.endpoint = trimTrailingSlashes(config.sidecarEndpoint());
    this.storage = storage;
    this.restClient = restClient;
  }

  @Override
  public String name() {
    return "Replit Object Storage";
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.REPLIT;
  }

  /** Metadata only: the object stays where its key puts it. */
  @Override
  public boolean supportsInPlaceVisibilityChange() {
    return true;
  }

  @Override
  protected void doInitialize() throws IOException {
    if (restClient == null) {
      var requestFactory = new SimpleClientHttpRequestFactory();
      requestFactory.setConnectTimeout(SIDECAR_TIMEOUT);
      requestFactory.setReadTimeout(SIDECAR_TIMEOUT);
      restClient = RestClient.builder().baseUrl(endpoint).requestFactory(requestFactory).build();
    }
    if (storage == null) {
      storage =
          StorageOptions.newBuilder().setCredentials(sidecarCredentials()).build().getService();
    }
    if (config.publicSearchPaths().isEmpty()) {
      log.warn("No public search paths configured; public/ keys cannot be stored");
    }
  }

  /** External-account credentials whose subject token is fetched from the sidecar. */
  private GoogleCredentials sidecarCredentials() throws IOException {
    var credentialSource = new LinkedHashMap<String, Object>();
    credentialSource.put("url", endpoint + "/credential");
    credentialSource.put(
        "format", Map.of("type", "json", "subject_token_field_name", "access_token"));

    var credentials = new LinkedHashMap<String, Object>();
    credentials.put("type", "external_account");
    credentials.put("audience", "replit");
    credentials.put("subject_token_type", "access_token");
    credentials.put("token_url", endpoint + "/token");
    credentials.put("credential_source", credentialSource);
    credentials.put("universe_domain", "googleapis.com");

    byte[] json = objectMapper.writeValueAsBytes(credentials);
    return GoogleCredentials.fromStream(new ByteArrayInputStream(json));
  }

  @Override
  protected boolean doHealthCheck() {
    try {
      var response = restClient.get().uri("/health").retrieve().toBodilessEntity();
      return response.getStatusCode().is2xxSuccessful();
    } catch (RestClientException e) {
      boolean configured =
          !config.publicSearchPaths().isEmpty()
              || (config.privateObjectDir() != null && !config.privateObjectDir().isBlank());
      log.warn(
          "Sidecar health probe failed at {}: {}; treating as healthy={}",
          endpoint,
          e.getMessage(),
          configured);
      return configured;
    }
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
    try (InputStream in = source.openStream()) {
      storage.createFrom(blobInfo, in);
    } catch (IOException | BaseServiceException e) {
      throw failure("Failed to upload: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, key, e);
    }
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
    log.info("Deleted object key={}", key);
  }

  @Override
  protected boolean doExists(String key) {
    return storage.get(blobId(key)) != null;
  }

  @Override
  public StorageMetadata getMetadata(String key) {
    requireReady(key);
    return GcsBlobs.toMetadata(requireBlob(key));
  }

  @Override
  public String getSignedUrl(String key, SignedUrlOptions options) {
    requireReady(key);
    BlobId blobId = blobId(key);
    var request = new LinkedHashMap<String, String>();
    request.put("bucket_name", blobId.getBucket());
    request.put("object_name", blobId.getName());
    request.put("method", options.method().name());
    request.put("expires_at", Instant.now().plusSeconds(options.ttlSec()).toString());

    SignedUrlResponse response;
    try {
      response =
          restClient
              .post()
              .uri(SIGNED_URL_PATH)
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(SignedUrlResponse.class);
    } catch (RestClientException e) {
      throw failure(
          "Failed to obtain signed URL from sidecar: " + e.getMessage(),
          StorageErrorCode.CONNECTION_ERROR,
          key,
          e);
    }
    if (response == null || response.signedUrl() == null || response.signedUrl().isBlank()) {
      throw failure(
          "Sidecar returned no signed URL", StorageErrorCode.CONNECTION_ERROR, key, null);
    }
    log.debug("Signed {} URL for key={} ttl={}s", options.method(), key, options.ttlSec());
    return response.signedUrl();
  }

  @Override
  public ListResult list(ListOptions options) {
    String prefix = options.effectivePrefix();
    requireInitialized(prefix);
    BlobId root =
        parseObjectPath(resolvePath(prefix.isEmpty() ? StorageKeys.PRIVATE_PREFIX : prefix));

    var listOptions = new ArrayList<Storage.BlobListOption>();
    listOptions.add(Storage.BlobListOption.pageSize(options.effectiveMaxResults()));
    if (!root.getName().isEmpty()) {
      listOptions.add(Storage.BlobListOption.prefix(root.getName()));
    }
    if (options.cursor() != null) {
      listOptions.add(Storage.BlobListOption.pageToken(options.cursor()));
    }

    try {
      Page<Blob> page =
          storage.list(root.getBucket(), listOptions.toArray(new Storage.BlobListOption[0]));
      var objects = new ArrayList<StorageObject>();
      for (Blob blob : page.getValues()) {
        String path = "/" + blob.getBucket() + "/" + blob.getName();
        objects.add(new StorageObject(toLogicalKey(path), GcsBlobs.toMetadata(blob)));
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
    Optional<ObjectAclPolicy> sourcePolicy = getAclPolicy(sourceKey);
    try {
      storage.copy(Storage.CopyRequest.of(blobId(sourceKey), blobId(destinationKey))).getResult();
    } catch (BaseServiceException e) {
      if (e.getCode() == 404) {
        throw notFound(sourceKey);
      }
      throw failure(
          "Failed to copy: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, sourceKey, e);
    }
    sourcePolicy
        .map(policy -> AclOverlay.retarget(policy, sourceKey, destinationKey))
        .filter(retargeted -> !retargeted.equals(sourcePolicy.get()))
        .ifPresent(retargeted -> writePolicy(destinationKey, existing -> retargeted));
    log.info("Copied object {} -> {}", sourceKey, destinationKey);
  }

  @Override
  public void setVisibility(String key, ObjectVisibility visibility) {
    requireReady(key);
    writePolicy(
        key,
        existing ->
            existing == null
                ? ObjectAclPolicy.of(visibility)
                : existing.withVisibility(visibility));
    log.info("Set visibility of key={} to {}", key, visibility);
  }

  @Override
  public Optional<ObjectAclPolicy> getAclPolicy(String key) {
    requireReady(key);
    Blob blob;
    try {
      blob = storage.get(blobId(key));
    } catch (BaseServiceException e) {
      throw failure(
          "Failed to read ACL policy: " + e.getMessage(),
          StorageErrorCode.DOWNLOAD_FAILED,
          key,
          e);
    }
    return blob == null ? Optional.empty() : readPolicy(blob);
  }

  @Override
  public void setAclPolicy(String key, ObjectAclPolicy policy) {
    requireReady(key);
    writePolicy(key, existing -> policy);
    log.info("Set ACL policy of key={} visibility={}", key, policy.visibility());
  }

  private Optional<ObjectAclPolicy> readPolicy(Blob blob) {
    String json = GcsBlobs.customMetadata(blob).get(ReplitAclDocument.METADATA_KEY);
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json, ReplitAclDocument.class).toPolicy());
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable ACL policy on {}: {}", blob.getName(), e.getMessage());
      return Optional.empty();
    }
  }

  /** Applies {@code update} under a metageneration precondition, re-reading on a lost race. */
  private void writePolicy(String key, UnaryOperator<ObjectAclPolicy> update) {
    for (int attempt = 1; ; attempt++) {
      Blob blob = requireBlob(key);
      ObjectAclPolicy next = update.apply(readPolicy(blob).orElse(null));
      var metadata = new HashMap<String, String>(GcsBlobs.customMetadata(blob));
      try {
        metadata.put(
            ReplitAclDocument.METADATA_KEY,
            objectMapper.writeValueAsString(ReplitAclDocument.from(next)));
        storage.update(
            blob.toBuilder().setMetadata(metadata).build(),
            Storage.BlobTargetOption.metagenerationMatch());
        return;
      } catch (BaseServiceException e) {
        if (e.getCode() == PRECONDITION_FAILED && attempt < POLICY_WRITE_ATTEMPTS) {
          log.debug("ACL policy of key={} changed concurrently; retrying", key);
          continue;
        }
        throw failure(
            "Failed to write ACL policy: " + e.getMessage(),
            StorageErrorCode.PERMISSION_DENIED,
            key,
            e);
      } catch (JsonProcessingException e) {
        throw failure(
            "Failed to write ACL policy: " + e.getMessage(),
            StorageErrorCode.PERMISSION_DENIED,
            key,
            e);
      }
    }
  }

  @Override
  public Optional<String> getPublicUrl(String key) {
    if (!StorageKeys.isPublicKey(key)
        || config.publicUrl() == null
        || config.publicUrl().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(
        trimTrailingSlashes(config.publicUrl()) + "/" + StorageKeys.stripNamespace(key));
  }

  /** Google Cloud Storage URLs become logical keys; anything else is returned as given. */
  @Override
  public String normalizeEntityPath(String rawPath) {
    if (rawPath == null || !rawPath.startsWith(GcsBlobs.PUBLIC_HOST)) {
      return rawPath;
    }
    return toLogicalKey(URI.create(rawPath).getPath());
  }

  @Override
  public Optional<StorageObject> searchPublicObject(String filePath) {
    requireInitialized(filePath);
    String relative = filePath.startsWith("/") ? filePath.substring(1) : filePath;
    for (String searchPath : config.publicSearchPaths()) {
      String fullPath = trimTrailingSlashes(searchPath) + "/" + relative;
      Blob blob;
      try {
        blob = storage.get(parseObjectPath(fullPath));
      } catch (BaseServiceException e) {
        throw failure(
            "Failed to probe " + fullPath + ": " + e.getMessage(),
            StorageErrorCode.CONNECTION_ERROR,
            filePath,
            e);
      }
      if (blob != null) {
        return Optional.of(new StorageObject(toLogicalKey(fullPath), GcsBlobs.toMetadata(blob)));
      }
    }
    return Optional.empty();
  }

  private Blob requireBlob(String key) {
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
    return blob;
  }

  @Override
  public void close() {
    if (storage == null) {
      return;
    }
    try {
      storage.close();
    } catch (Exception e) {
      log.warn("Failed to close Cloud Storage client: {}", e.getMessage());
    }
  }

  private BlobId blobId(String key) {
    return parseObjectPath(resolvePath(key));
  }

  /** Absolute {@code /bucket/object} path for a logical key. */
  String resolvePath(String key) {
    if (key.startsWith("/")) {
      return key;
    }
    if (Namespace.fromPrefix(key) == Namespace.PUBLIC) {
      if (config.publicSearchPaths().isEmpty()) {
        throw failure(
            "PUBLIC_OBJECT_SEARCH_PATHS not configured",
            StorageErrorCode.CONFIGURATION_ERROR,
            key,
            null);
      }
      return trimTrailingSlashes(config.publicSearchPaths().get(0))
          + "/"
          + StorageKeys.stripNamespace(key);
    }
    if (config.privateObjectDir() == null || config.privateObjectDir().isBlank()) {
      throw failure(
          "PRIVATE_OBJECT_DIR not configured", StorageErrorCode.CONFIGURATION_ERROR, key, null);
    }
    return trimTrailingSlashes(config.privateObjectDir()) + "/" + StorageKeys.stripNamespace(key);
  }

  /** Inverse of {@link #resolvePath}; paths outside both roots stay absolute. */
  String toLogicalKey(String path) {
    String privateRoot = rootOf(config.privateObjectDir());
    if (privateRoot != null && path.startsWith(privateRoot)) {
      return StorageKeys.withNamespace(Namespace.PRIVATE, path.substring(privateRoot.length()));
    }
    if (!config.publicSearchPaths().isEmpty()) {
      String publicRoot = rootOf(config.publicSearchPaths().get(0));
      if (path.startsWith(publicRoot)) {
        return StorageKeys.withNamespace(Namespace.PUBLIC, path.substring(publicRoot.length()));
      }
    }
    return path;
  }

  BlobId parseObjectPath(String path) {
    String normalized = path.startsWith("/") ? path : "/" + path;
    String[] parts = normalized.split("/", -1);
    if (parts.length < 3 || parts[1].isEmpty()) {
      throw failure(
          "Invalid path: must contain at least a bucket name",
          StorageErrorCode.INVALID_KEY,
          path,
          null);
    }
    return BlobId.of(parts[1], String.join("/", Arrays.copyOfRange(parts, 2, parts.length)));
  }

  private static String rootOf(String dir) {
    if (dir == null || dir.isBlank()) {
      return null;
    }
    String trimmed = trimTrailingSlashes(dir);
    return (trimmed.startsWith("/") ? trimmed : "/" + trimmed) + "/";
  }

  private static String trimTrailingSlashes(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  record SignedUrlResponse(@JsonProperty("signed_url") String signedUrl) {}
}
