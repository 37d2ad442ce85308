package io.socialcomply.platform.integration.storage.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.socialcomply.platform.integration.storage.AbstractStorageProvider;
import io.socialcomply.platform.integration.storage.AclOverlay;
import io.socialcomply.platform.integration.storage.DownloadResult;
import io.socialcomply.platform.integration.storage.ListOptions;
import io.socialcomply.platform.integration.storage.ListResult;
import io.socialcomply.platform.integration.storage.Namespace;
import io.socialcomply.platform.integration.storage.ObjectAclPolicy;
import io.socialcomply.platform.integration.storage.ObjectVisibility;
import io.socialcomply.platform.integration.storage.SignedUrlMethod;
import io.socialcomply.platform.integration.storage.SignedUrlOptions;
import io.socialcomply.platform.integration.storage.StorageErrorCode;
import io.socialcomply.platform.integration.storage.StorageException;
import io.socialcomply.platform.integration.storage.StorageKeys;
import io.socialcomply.platform.integration.storage.StorageMetadata;
import io.socialcomply.platform.integration.storage.StorageObject;
import io.socialcomply.platform.integration.storage.StorageProviderType;
import io.socialcomply.platform.integration.storage.UploadOptions;
import io.socialcomply.platform.integration.storage.UploadSource;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem implementation of {@link io.socialcomply.platform.integration.storage.StorageProvider}
 * for development and single-node deployments.
 *
 * <p>Objects live under {@code <basePath>/<publicBucket>} and {@code <basePath>/<privateBucket>}.
 * Each object has a {@code <name>.meta.json} sidecar holding its content type, custom metadata and
 * ACL policy. Objects and sidecars are written to a staging file and renamed into place, so readers
 * never observe a partial write.
 */
public class LocalStorageProvider extends AbstractStorageProvider {

  private static final Logger log = LoggerFactory.getLogger(LocalStorageProvider.class);

  static final String SIDECAR_SUFFIX = ".meta.json";
  private static final String STAGING_DIR = ".staging";
  private static final int GENERATED_SECRET_BYTES = 32;
  private static final int SIDECAR_LOCK_STRIPES = 64;

  private final LocalStorageConfig config;
  private final ObjectMapper objectMapper;
  private final Path root;
  private final Path publicDir;
  private final Path privateDir;
  private final Path stagingDir;
  private final String publicUrlBase;
  private final Object[] sidecarLocks = new Object[SIDECAR_LOCK_STRIPES];

  private LocalSignedUrlSigner signer;

  public LocalStorageProvider(LocalStorageConfig config, ObjectMapper objectMapper) {
    this.config = config;
    this.objectMapper = objectMapper;
    this.root = config.basePath().toAbsolutePath().normalize();
    this.publicDir = root.resolve(config.publicBucket()).normalize();
    this.privateDir = root.resolve(config.privateBucket()).normalize();
    this.stagingDir = root.resolve(STAGING_DIR);
    this.publicUrlBase =
        config.publicUrl() == null || config.publicUrl().isBlank()
            ? null
            : config.publicUrl().replaceAll("/+$", "");
    for (int i = 0; i < sidecarLocks.length; i++) {
      sidecarLocks[i] = new Object();
    }
  }

  @Override
  public String name() {
    return "Local Filesystem";
  }

  @Override
  public StorageProviderType type() {
    return StorageProviderType.LOCAL;
  }

  @Override
  public boolean supportsInPlaceVisibilityChange() {
    return true;
  }

  @Override
  protected void doInitialize() throws IOException {
    Files.createDirectories(publicDir);
    Files.createDirectories(privateDir);
    Files.createDirectories(stagingDir);
    signer = new LocalSignedUrlSigner(signingSecret(), publicUrlBase);
    if (publicUrlBase == null) {
      log.warn(
          "storage.local.public-url is not set; signed and public URLs are unavailable for {}",
          root);
    }
    log.info("Local storage rooted at {}", root);
  }

  private byte[] signingSecret() {
    String configured = config.signingSecret();
    if (configured != null && !configured.isBlank()) {
      return configured.getBytes(StandardCharsets.UTF_8);
    }
    log.warn(
        "storage.local.signing-secret is not set; using a random key. Signed URLs will not"
            + " survive a restart");
    byte[] secret = new byte[GENERATED_SECRET_BYTES];
    new SecureRandom().nextBytes(secret);
    return secret;
  }

  @Override
  protected boolean doHealthCheck() {
    return Files.isDirectory(publicDir)
        && Files.isDirectory(privateDir)
        && Files.isWritable(root);
  }

  @Override
  public String upload(String key, UploadSource source, UploadOptions options) {
    requireReady(key);
    var effective = options != null ? options : UploadOptions.defaults();
    Path target = writePath(key, effective.isPublic());
    var visibility =
        target.startsWith(publicDir) ? ObjectVisibility.PUBLIC : ObjectVisibility.PRIVATE;

    try (InputStream in = source.openStream()) {
      Files.createDirectories(target.getParent());
      writeAtomically(target, in);
      writeSidecar(
          target,
          new LocalObjectSidecar(
              effective.contentType(),
              effective.metadata(),
              Instant.now().toString(),
              visibility,
              null,
              null));
      if (Namespace.fromPrefix(key) == null) {
        removeShadowCopy(target, StorageKeys.stripNamespace(key));
      }
    } catch (IOException e) {
      throw failure(
          "Failed to upload object: " + e.getMessage(), StorageErrorCode.UPLOAD_FAILED, key, e);
    }
    log.info("Uploaded object key={} contentType={}", key, effective.contentType());
    return key;
  }

  @Override
  public DownloadResult download(String key) {
    requireReady(key);
    Path path = requireExisting(key);
    try {
      StorageMetadata metadata = metadataFor(path);
      return new DownloadResult(Files.newInputStream(path), metadata);
    } catch (NoSuchFileException e) {
      throw notFound(key);
    } catch (IOException e) {
      throw failure(
          "Failed to download object: " + e.getMessage(),
          StorageErrorCode.DOWNLOAD_FAILED,
          key,
          e);
    }
  }

  @Override
  public void delete(String key) {
    requireReady(key);
    try {
      boolean deleted = false;
      for (Path candidate : candidatePaths(key)) {
        deleted |= Files.deleteIfExists(candidate);
        Files.deleteIfExists(sidecarPath(candidate));
      }
      if (deleted) {
        log.info("Deleted object key={}", key);
      } else {
        log.debug("Delete of missing key={} ignored", key);
      }
    } catch (IOException e) {
      throw failure(
          "Failed to delete object: " + e.getMessage(), StorageErrorCode.DELETE_FAILED, key, e);
    }
  }

  @Override
  protected boolean doExists(String key) {
    return existingPath(key).isPresent();
  }

  @Override
  public StorageMetadata getMetadata(String key) {
    requireReady(key);
    Path path = requireExisting(key);
    try {
      return metadataFor(path);
    } catch (NoSuchFileException e) {
      throw notFound(key);
    } catch (IOException e) {
      throw failure(
          "Failed to read metadata: " + e.getMessage(),
          StorageErrorCode.DOWNLOAD_FAILED,
          key,
          e);
    }
  }

  @Override
  public String getSignedUrl(String key, SignedUrlOptions options) {
    requireReady(key);
    if (publicUrlBase == null) {
      throw new StorageException(
          "Local signed URLs require storage.local.public-url (LOCAL_STORAGE_PUBLIC_URL)",
          StorageErrorCode.CONFIGURATION_ERROR,
          key,
          name());
    }
    Instant expiresAt = Instant.now().plusSeconds(options.ttlSec());
    return signer.signedUrl(key, options.method(), expiresAt, options.enforcedContentType());
  }

  /** Whether a request carrying these signed-URL parameters is authentic and unexpired. */
  public boolean verifySignedRequest(
      String key, SignedUrlMethod method, long expires, String contentType, String signature) {
    requireInitialized(key);
    return signer.verify(key, method, expires, contentType, signature, Instant.now());
  }

  @Override
  public ListResult list(ListOptions options) {
    String prefix = options.effectivePrefix();
    requireInitialized(prefix);
    Namespace namespace = StorageKeys.namespaceOf(prefix, Namespace.PRIVATE);
    Path dir = directoryFor(namespace);
    String namePrefix = StorageKeys.stripNamespace(prefix);
    String after = decodeCursor(options.cursor());
    int maxResults = options.effectiveMaxResults();

    if (!Files.isDirectory(dir)) {
      return new ListResult(List.of(), null);
    }
    try (Stream<Path> walk = Files.walk(dir)) {
      List<String> names =
          walk.filter(Files::isRegularFile)
              .map(path -> dir.relativize(path).toString().replace(File.separatorChar, '/'))
              .filter(name -> !name.endsWith(SIDECAR_SUFFIX))
              .filter(name -> name.startsWith(namePrefix))
              .filter(name -> after == null || name.compareTo(after) > 0)
              .sorted()
              .toList();

      List<String> page = names.subList(0, Math.min(maxResults, names.size()));
      var objects = new ArrayList<StorageObject>(page.size());
      for (String name : page) {
        try {
          objects.add(
              new StorageObject(
                  StorageKeys.withNamespace(namespace, name), metadataFor(dir.resolve(name))));
        } catch (NoSuchFileException e) {
          log.debug("Object {} vanished during listing", name);
        }
      }
      String nextCursor =
          names.size() > maxResults ? encodeCursor(page.get(page.size() - 1)) : null;
      log.debug("Listed {} objects under prefix={}", objects.size(), prefix);
      return new ListResult(objects, nextCursor);
    } catch (IOException | UncheckedIOException e) {
      throw failure(
          "Failed to list objects: " + e.getMessage(),
          StorageErrorCode.CONNECTION_ERROR,
          prefix,
          e);
    }
  }

  @Override
  public void copy(String sourceKey, String destinationKey) {
    requireReady(sourceKey);
    requireReady(destinationKey);
    Path source = requireExisting(sourceKey);
    Namespace destinationNamespace = Namespace.fromPrefix(destinationKey);
    Path destinationDir =
        destinationNamespace != null
            ? directoryFor(destinationNamespace)
            : (source.startsWith(publicDir) ? publicDir : privateDir);
    Path target =
        objectPath(destinationDir, StorageKeys.stripNamespace(destinationKey), destinationKey);

    try (InputStream in = Files.newInputStream(source)) {
      Files.createDirectories(target.getParent());
      writeAtomically(target, in);
      Optional<LocalObjectSidecar> sidecar = readSidecar(source);
      if (sidecar.isPresent()) {
        var policy = AclOverlay.retarget(sidecar.get().toPolicy(), sourceKey, destinationKey);
        writeSidecar(target, sidecar.get().withPolicy(policy));
      }
    } catch (NoSuchFileException e) {
      throw notFound(sourceKey);
    } catch (IOException e) {
      throw failure(
          "Failed to copy object to " + destinationKey + ": " + e.getMessage(),
          StorageErrorCode.UPLOAD_FAILED,
          sourceKey,
          e);
    }
    log.info("Copied object {} -> {}", sourceKey, destinationKey);
  }

  @Override
  public void setVisibility(String key, ObjectVisibility visibility) {
    requireReady(key);
    Path path = requireExisting(key);
    updatePolicy(key, path, sidecar -> sidecar.toPolicy().withVisibility(visibility));
    log.info("Set visibility of key={} to {}", key, visibility);
  }

  @Override
  public Optional<ObjectAclPolicy> getAclPolicy(String key) {
    requireReady(key);
    try {
      Optional<Path> path = existingPath(key);
      if (path.isEmpty()) {
        return Optional.empty();
      }
      return readSidecar(path.get()).map(LocalObjectSidecar::toPolicy);
    } catch (IOException e) {
      throw failure(
          "Failed to read ACL policy: " + e.getMessage(),
          StorageErrorCode.DOWNLOAD_FAILED,
          key,
          e);
    }
  }

  @Override
  public void setAclPolicy(String key, ObjectAclPolicy policy) {
    requireReady(key);
    Path path = requireExisting(key);
    updatePolicy(key, path, sidecar -> policy);
    log.info("Set ACL policy of key={} visibility={}", key, policy.visibility());
  }

  @Override
  protected boolean isStructurallyPublic(String key) {
    if (StorageKeys.isPublicKey(key)) {
      return true;
    }
    return Namespace.fromPrefix(key) == null
        && existingPath(key).map(path -> path.startsWith(publicDir)).orElse(false);
  }

  @Override
  public Optional<String> getPublicUrl(String key) {
    if (publicUrlBase == null || key == null) {
      return Optional.empty();
    }
    try {
      StorageKeys.validate(key, name());
      boolean isPublic =
          StorageKeys.isPublicKey(key)
              || (isInitialized()
                  && Namespace.fromPrefix(key) == null
                  && existingPath(key).map(path -> path.startsWith(publicDir)).orElse(false));
      if (!isPublic) {
        return Optional.empty();
      }
      return Optional.of(
          publicUrlBase + "/" + config.publicBucket() + "/" + StorageKeys.stripNamespace(key));
    } catch (StorageException e) {
      return Optional.empty();
    }
  }

  /** Absolute filesystem paths and public URLs map back to keys; other input is returned as is. */
  @Override
  public String normalizeEntityPath(String rawPath) {
    if (rawPath == null || rawPath.isBlank()) {
      return rawPath;
    }
    return translateBackendReference(rawPath).orElse(rawPath);
  }

  @Override
  protected Optional<String> translateBackendReference(String rawPath) {
    if (publicUrlBase != null) {
      String publicBase = publicUrlBase + "/" + config.publicBucket() + "/";
      if (rawPath.startsWith(publicBase)) {
        return Optional.of(StorageKeys.PUBLIC_PREFIX + rawPath.substring(publicBase.length()));
      }
    }
    try {
      Path path = Path.of(rawPath);
      if (!path.isAbsolute()) {
        return Optional.empty();
      }
      Path normalized = path.normalize();
      if (normalized.startsWith(privateDir) && !normalized.equals(privateDir)) {
        return Optional.of(
            StorageKeys.withNamespace(Namespace.PRIVATE, relativeName(privateDir, normalized)));
      }
      if (normalized.startsWith(publicDir) && !normalized.equals(publicDir)) {
        return Optional.of(
            StorageKeys.withNamespace(Namespace.PUBLIC, relativeName(publicDir, normalized)));
      }
    } catch (InvalidPathException e) {
      log.debug("Not a filesystem path: {}", rawPath);
    }
    return Optional.empty();
  }

  private void updatePolicy(
      String key, Path path, Function<LocalObjectSidecar, ObjectAclPolicy> update) {
    try {
      synchronized (sidecarLock(path)) {
        LocalObjectSidecar sidecar =
            readSidecar(path)
                .orElseGet(
                    () ->
                        new LocalObjectSidecar(
                            UploadOptions.DEFAULT_CONTENT_TYPE,
                            null,
                            Instant.now().toString(),
                            path.startsWith(publicDir)
                                ? ObjectVisibility.PUBLIC
                                : ObjectVisibility.PRIVATE,
                            null,
                            null));
        writeSidecar(path, sidecar.withPolicy(update.apply(sidecar)));
      }
    } catch (IOException e) {
      throw failure(
          "Failed to update ACL policy: " + e.getMessage(),
          StorageErrorCode.UPLOAD_FAILED,
          key,
          e);
    }
  }

  private Path directoryFor(Namespace namespace) {
    return namespace == Namespace.PUBLIC ? publicDir : privateDir;
  }

  private Path objectPath(Path dir, String name, String key) {
    if (name.isEmpty()
        || name.startsWith("/")
        || name.endsWith("/")
        || name.endsWith(SIDECAR_SUFFIX)) {
      throw new StorageException(
          "Key does not name a storable object: " + key, StorageErrorCode.INVALID_KEY, key, name());
    }
    Path path = dir.resolve(name).normalize();
    if (!path.startsWith(dir) || path.equals(dir)) {
      throw new StorageException(
          "Key escapes its namespace: " + key, StorageErrorCode.INVALID_KEY, key, name());
    }
    return path;
  }

  private Path writePath(String key, boolean isPublic) {
    Namespace namespace = Namespace.fromPrefix(key);
    Path dir =
        namespace != null ? directoryFor(namespace) : (isPublic ? publicDir : privateDir);
    return objectPath(dir, StorageKeys.stripNamespace(key), key);
  }

  /** Prefixed keys have one location; unprefixed keys are probed private first, then public. */
  private List<Path> candidatePaths(String key) {
    Namespace namespace = Namespace.fromPrefix(key);
    String name = StorageKeys.stripNamespace(key);
    if (namespace != null) {
      return List.of(objectPath(directoryFor(namespace), name, key));
    }
    return List.of(objectPath(privateDir, name, key), objectPath(publicDir, name, key));
  }

  private Optional<Path> existingPath(String key) {
    return candidatePaths(key).stream().filter(Files::isRegularFile).findFirst();
  }

  private Path requireExisting(String key) {
    return existingPath(key).orElseThrow(() -> notFound(key));
  }

  private void removeShadowCopy(Path written, String name) throws IOException {
    Path other = written.startsWith(publicDir) ? privateDir.resolve(name) : publicDir.resolve(name);
    if (Files.deleteIfExists(other)) {
      Files.deleteIfExists(sidecarPath(other));
      log.debug("Removed stale copy of {} at {}", name, other);
    }
  }

  private StorageMetadata metadataFor(Path path) throws IOException {
    var attributes = Files.readAttributes(path, BasicFileAttributes.class);
    Optional<LocalObjectSidecar> sidecar = readSidecar(path);
    return new StorageMetadata(
        sidecar.map(LocalObjectSidecar::contentType).orElse(UploadOptions.DEFAULT_CONTENT_TYPE),
        attributes.size(),
        attributes.lastModifiedTime().toInstant(),
        null,
        sidecar.map(LocalObjectSidecar::metadata).orElse(null));
  }

  private static Path sidecarPath(Path objectPath) {
    return objectPath.resolveSibling(objectPath.getFileName() + SIDECAR_SUFFIX);
  }

  private Optional<LocalObjectSidecar> readSidecar(Path objectPath) throws IOException {
    Path sidecar = sidecarPath(objectPath);
    if (!Files.isRegularFile(sidecar)) {
      return Optional.empty();
    }
    return Optional.of(objectMapper.readValue(sidecar.toFile(), LocalObjectSidecar.class));
  }

  private void writeSidecar(Path objectPath, LocalObjectSidecar sidecar) throws IOException {
    byte[] json = objectMapper.writeValueAsBytes(sidecar);
    synchronized (sidecarLock(objectPath)) {
      writeAtomically(sidecarPath(objectPath), new ByteArrayInputStream(json));
    }
  }

  /** Sidecar read-modify-write cycles on one object hold the same monitor. */
  private Object sidecarLock(Path objectPath) {
    return sidecarLocks[Math.floorMod(objectPath.hashCode(), sidecarLocks.length)];
  }

  private void writeAtomically(Path target, InputStream content) throws IOException {
    Files.createDirectories(stagingDir);
    Path staged = Files.createTempFile(stagingDir, "upload-", ".tmp");
    try {
      Files.copy(content, staged, StandardCopyOption.REPLACE_EXISTING);
      try {
        Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      Files.deleteIfExists(staged);
      throw e;
    }
  }

  private static String relativeName(Path dir, Path path) {
    return dir.relativize(path).toString().replace(File.separatorChar, '/');
  }

  private static String encodeCursor(String lastName) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(lastName.getBytes(StandardCharsets.UTF_8));
  }

  private String decodeCursor(String cursor) {
    if (cursor == null || cursor.isEmpty()) {
      return null;
    }
    try {
      return new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new StorageException(
          "Malformed list cursor", StorageErrorCode.INVALID_KEY, null, name(), e);
    }
  }
}
