package io.socialcomply.platform.integration.storage.s3;

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
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectAclRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.DeleteObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/**
 * S3 implementation of {@link io.socialcomply.platform.integration.storage.StorageProvider}. All
 * AWS SDK types are confined to this class.
 *
 * <p>Visibility is the object's canned ACL; allow-lists live in an in-process {@link AclOverlay}.
 */
public class S3StorageProvider extends AbstractStorageProvider {

  private static final Logger log = LoggerFactory.getLogger(S3StorageProvider.class);

  private static final String DEFAULT_REGION = "us-east-1";

  private final S3StorageConfig config;
  private final AclOverlay aclOverlay = new AclOverlay();

  private S3Client s3Client;
  private S3Presigner s3Presigner;

  public S3StorageProvider(S3StorageConfig config) {
    this(config, null, null);
  }

  /** Package-private constructor for testing with pre-built clients. */
  S3StorageProvider(S3StorageConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    this.config = config;
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
  }

  @Override
  public String name() {
    return "AWS S3";
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.S3;
  }

  @Override
  public boolean supportsInPlaceVisibilityChange() {
    return true;
  }

  @Override
  protected void doInitialize() {
    if (s3Client == null) {
      s3Client = buildClient();
    }
    if (s3Presigner == null) {
      s3Presigner = buildPresigner();
    }
    ensureBucket(config.publicBucket());
    ensureBucket(config.privateBucket());
  }

  private S3Client buildClient() {
    var builder = S3Client.builder().region(region()).credentialsProvider(credentialsProvider());
    if (config.hasEndpoint()) {
      builder
          .endpointOverride(URI.create(config.endpoint()))
          .serviceConfiguration(
              S3Configuration.builder().pathStyleAccessEnabled(config.forcePathStyle()).build());
    }
    return builder.build();
  }

  private S3Presigner buildPresigner() {
    var builder =
        S3Presigner.builder().region(region()).credentialsProvider(credentialsProvider());
    if (config.hasEndpoint()) {
      builder
          .endpointOverride(URI.create(config.endpoint()))
          .serviceConfiguration(
              S3Configuration.builder().pathStyleAccessEnabled(config.forcePathStyle()).build());
    }
    return builder.build();
  }

  private Region region() {
    return Region.of(config.region() != null ? config.region() : DEFAULT_REGION);
  }

  private AwsCredentialsProvider credentialsProvider() {
    if (config.hasStaticCredentials()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(config.accessKeyId(), config.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }

  private void ensureBucket(String bucket) {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      var request = CreateBucketRequest.builder().bucket(bucket);
      if (!config.hasEndpoint() && !DEFAULT_REGION.equals(region().id())) {
        request.createBucketConfiguration(
            CreateBucketConfiguration.builder().locationConstraint(region().id()).build());
      }
      s3Client.createBucket(request.build());
      log.info("Created S3 bucket {}", bucket);
    }
  }

  @Override
  protected boolean doHealthCheck() {
    s3Client.headBucket(HeadBucketRequest.builder().bucket(config.privateBucket()).build());
    return true;
  }

  @Override
  public String upload(String key, UploadSource source, UploadOptions options) {
    requireReady(key);
    var effective = options != null ? options : UploadOptions.defaults();
    boolean publicRead =
        effective.isPublic() || StorageKeys.namespaceOf(key, Namespace.PRIVATE) == Namespace.PUBLIC;
    var putRequest =
        PutObjectRequest.builder()
            .bucket(bucketFor(key))
            .key(StorageKeys.stripNamespace(key))
            .contentType(effective.contentType())
            .metadata(effective.metadata())
            .acl(publicRead ? ObjectCannedACL.PUBLIC_READ : ObjectCannedACL.PRIVATE)
            .build();

    try {
      if (source.contentLength() >= 0) {
        try (InputStream in = source.openStream()) {
          s3Client.putObject(putRequest, RequestBody.fromInputStream(in, source.contentLength()));
        }
      } else {
        putFromSpillFile(putRequest, source);
      }
    } catch (SdkException | IOException e) {
      throw failure("Failed to upload: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, key, e);
    }
    // The replaced object's allow-lists do not carry over to the new one.
    aclOverlay.remove(key);
    log.info("Uploaded object key={} contentType={}", key, effective.contentType());
    return key;
  }

  /** PutObject needs a length up front; streams of unknown length go through a temp file. */
  private void putFromSpillFile(PutObjectRequest putRequest, UploadSource source)
      throws IOException {
    Path spill = Files.createTempFile("s3-upload-", ".tmp");
    try (InputStream in = source.openStream()) {
      Files.copy(in, spill, StandardCopyOption.REPLACE_EXISTING);
      s3Client.putObject(putRequest, RequestBody.fromFile(spill));
    } finally {
      Files.deleteIfExists(spill);
    }
  }

  @Override
  public DownloadResult download(String key) {
    requireReady(key);
    var getRequest =
        GetObjectRequest.builder()
            .bucket(bucketFor(key))
            .key(StorageKeys.stripNamespace(key))
            .build();
    try {
      ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest);
      GetObjectResponse object = response.response();
      return new DownloadResult(
          response,
          new StorageMetadata(
              object.contentType(),
              object.contentLength(),
              object.lastModified(),
              object.eTag(),
              object.metadata()));
    } catch (NoSuchKeyException e) {
      throw notFound(key);
    } catch (SdkException e) {
      throw failure(
          "Failed to download: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
  }

  @Override
  public void delete(String key) {
    requireReady(key);
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder()
              .bucket(bucketFor(key))
              .key(StorageKeys.stripNamespace(key))
              .build());
    } catch (SdkException e) {
      throw failure("Failed to delete: " + e.getMessage(), StorageErrorCode.DELETE_FAILED, key, e);
    }
    aclOverlay.remove(key);
    log.info("Deleted object key={}", key);
  }

  @Override
  protected boolean doExists(String key) {
    try {
      head(key);
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    }
  }

  @Override
  public StorageMetadata getMetadata(String key) {
    requireReady(key);
    try {
      HeadObjectResponse response = head(key);
      return new StorageMetadata(
          response.contentType(),
          response.contentLength(),
          response.lastModified(),
          response.eTag(),
          response.metadata());
    } catch (NoSuchKeyException e) {
      throw notFound(key);
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw notFound(key);
      }
      throw failure(
          "Failed to read metadata: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    } catch (SdkException e) {
      throw failure(
          "Failed to read metadata: " + e.getMessage(), StorageErrorCode.DOWNLOAD_FAILED, key, e);
    }
  }

  private HeadObjectResponse head(String key) {
    return s3Client.headObject(
        HeadObjectRequest.builder()
            .bucket(bucketFor(key))
            .key(StorageKeys.stripNamespace(key))
            .build());
  }

  @Override
  public String getSignedUrl(String key, SignedUrlOptions options) {
    requireReady(key);
    String bucket = bucketFor(key);
    String objectKey = StorageKeys.stripNamespace(key);
    Duration expiry = Duration.ofSeconds(options.ttlSec());

    try {
      return switch (options.method()) {
        case GET -> s3Presigner
            .presignGetObject(
                GetObjectPresignRequest.builder()
                    .signatureDuration(expiry)
                    .getObjectRequest(
                        GetObjectRequest.builder().bucket(bucket).key(objectKey).build())
                    .build())
            .url()
            .toExternalForm();
        case PUT -> s3Presigner
            .presignPutObject(
                PutObjectPresignRequest.builder()
                    .signatureDuration(expiry)
                    .putObjectRequest(
                        PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(objectKey)
                            .contentType(options.enforcedContentType())
                            .build())
                    .build())
            .url()
            .toExternalForm();
        case DELETE -> s3Presigner
            .presignDeleteObject(
                DeleteObjectPresignRequest.builder()
                    .signatureDuration(expiry)
                    .deleteObjectRequest(
                        DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build())
                    .build())
            .url()
            .toExternalForm();
        case HEAD -> throw failure(
            "The S3 presigner does not sign HEAD requests; sign a GET instead",
            StorageErrorCode.PERMISSION_DENIED,
            key,
            null);
      };
    } catch (SdkException e) {
      throw failure(
          "Failed to sign URL: " + e.getMessage(), StorageErrorCode.CONFIGURATION_ERROR, key, e);
    }
  }

  @Override
  public ListResult list(ListOptions options) {
    String prefix = options.effectivePrefix();
    requireInitialized(prefix);
    Namespace namespace = StorageKeys.namespaceOf(prefix, Namespace.PRIVATE);
    String objectPrefix = StorageKeys.stripNamespace(prefix);

    try {
      var response =
          s3Client.listObjectsV2(
              ListObjectsV2Request.builder()
                  .bucket(bucketFor(namespace))
                  .prefix(objectPrefix.isEmpty() ? null : objectPrefix)
                  .maxKeys(options.effectiveMaxResults())
                  .continuationToken(options.cursor())
                  .build());

      List<StorageObject> objects =
          response.contents().stream()
              .map(
                  object ->
                      new StorageObject(
                          StorageKeys.withNamespace(namespace, object.key()),
                          new StorageMetadata(
                              null, object.size(), object.lastModified(), object.eTag(), null)))
              .toList();
      log.debug("Listed {} objects under prefix={}", objects.size(), prefix);
      return new ListResult(objects, response.nextContinuationToken());
    } catch (SdkException e) {
      throw failure(
          "Failed to list: " + e.getMessage(), StorageErrorCode.CONNECTION_ERROR, prefix, e);
    }
  }

  @Override
  public void copy(String sourceKey, String destinationKey) {
    requireReady(sourceKey);
    requireReady(destinationKey);
    boolean destinationPublic =
        StorageKeys.namespaceOf(destinationKey, Namespace.PRIVATE) == Namespace.PUBLIC;
    try {
      s3Client.copyObject(
          CopyObjectRequest.builder()
              .sourceBucket(bucketFor(sourceKey))
              .sourceKey(StorageKeys.stripNamespace(sourceKey))
              .destinationBucket(bucketFor(destinationKey))
              .destinationKey(StorageKeys.stripNamespace(destinationKey))
              .acl(destinationPublic ? ObjectCannedACL.PUBLIC_READ : ObjectCannedACL.PRIVATE)
              .build());
    } catch (NoSuchKeyException e) {
      throw notFound(sourceKey);
    } catch (SdkException e) {
      throw failure(
          "Failed to copy: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, sourceKey, e);
    }
    aclOverlay.copy(sourceKey, destinationKey);
    log.info("Copied object {} -> {}", sourceKey, destinationKey);
  }

  @Override
  public void setVisibility(String key, ObjectVisibility visibility) {
    requireReady(key);
    applyCannedAcl(key, visibility);
    aclOverlay.updateVisibility(key, visibility);
    log.info("Set visibility of key={} to {}", key, visibility);
  }

  private void applyCannedAcl(String key, ObjectVisibility visibility) {
    try {
      s3Client.putObjectAcl(
          PutObjectAclRequest.builder()
              .bucket(bucketFor(key))
              .key(StorageKeys.stripNamespace(key))
              .acl(
                  visibility == ObjectVisibility.PUBLIC
                      ? ObjectCannedACL.PUBLIC_READ
                      : ObjectCannedACL.PRIVATE)
              .build());
    } catch (NoSuchKeyException e) {
      throw notFound(key);
    } catch (SdkException e) {
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
    applyCannedAcl(key, policy.visibility());
    aclOverlay.put(key, policy);
    log.info("Set ACL policy of key={} visibility={}", key, policy.visibility());
  }

  @Override
  public Optional<String> getPublicUrl(String key) {
    if (!StorageKeys.isPublicKey(key)) {
      return Optional.empty();
    }
    return Optional.of(bucketBaseUrl(config.publicBucket()) + StorageKeys.stripNamespace(key));
  }

  @Override
  protected Optional<String> translateBackendReference(String rawPath) {
    for (Namespace namespace : Namespace.values()) {
      String bucket = bucketFor(namespace);
      for (String base : List.of(bucketBaseUrl(bucket), "s3://" + bucket + "/")) {
        if (rawPath.startsWith(base) && rawPath.length() > base.length()) {
          return Optional.of(
              StorageKeys.withNamespace(namespace, rawPath.substring(base.length())));
        }
      }
    }
    return Optional.empty();
  }

  private String bucketBaseUrl(String bucket) {
    if (config.hasEndpoint()) {
      return config.endpoint().replaceAll("/+$", "") + "/" + bucket + "/";
    }
    return "https://" + bucket + ".s3." + region().id() + ".amazonaws.com/";
  }

  @Override
  public void close() {
    if (s3Presigner != null) {
      s3Presigner.close();
    }
    if (s3Client != null) {
      s3Client.close();
    }
  }

  private String bucketFor(String key) {
    return bucketFor(StorageKeys.namespaceOf(key, Namespace.PRIVATE));
  }

  private String bucketFor(Namespace namespace) {
    return namespace == Namespace.PUBLIC ? config.publicBucket() : config.privateBucket();
  }
}
