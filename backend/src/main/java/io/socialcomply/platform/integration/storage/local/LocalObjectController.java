package io.socialcomply.platform.integration.storage.local;

import io.socialcomply.platform.exception.SignedUrlRejectedException;
import io.socialcomply.platform.integration.storage.DownloadOptions;
import io.socialcomply.platform.integration.storage.ServletResponseSink;
import io.socialcomply.platform.integration.storage.SignedUrlMethod;
import io.socialcomply.platform.integration.storage.StorageProvider;
import io.socialcomply.platform.integration.storage.UploadOptions;
import io.socialcomply.platform.integration.storage.UploadSource;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves URLs issued by {@link LocalStorageProvider#getSignedUrl}. Every request must carry a
 * valid, unexpired signature for exactly the key, verb and content type it targets.
 */
@RestController
@RequestMapping(LocalSignedUrlSigner.ENDPOINT_PATH)
@ConditionalOnProperty(name = "storage.provider", havingValue = "local", matchIfMissing = true)
public class LocalObjectController {

  private static final Logger log = LoggerFactory.getLogger(LocalObjectController.class);

  private final LocalStorageProvider storageProvider;

  public LocalObjectController(StorageProvider storageProvider) {
    if (!(storageProvider instanceof LocalStorageProvider localProvider)) {
      throw new IllegalStateException(
          "LocalObjectController requires the local storage provider, found "
              + storageProvider.getClass().getName());
    }
    this.storageProvider = localProvider;
  }

  @GetMapping
  public void download(
      @RequestParam String key,
      @RequestParam String method,
      @RequestParam long expires,
      @RequestParam(required = false) String contentType,
      @RequestParam String signature,
      HttpServletResponse response) {
    authorize(SignedUrlMethod.GET, key, method, expires, contentType, signature);
    storageProvider.streamToResponse(
        key, new ServletResponseSink(response), DownloadOptions.noStore());
  }

  @RequestMapping(method = RequestMethod.HEAD)
  public ResponseEntity<Void> head(
      @RequestParam String key,
      @RequestParam String method,
      @RequestParam long expires,
      @RequestParam(required = false) String contentType,
      @RequestParam String signature) {
    authorize(SignedUrlMethod.HEAD, key, method, expires, contentType, signature);
    var metadata = storageProvider.getMetadata(key);
    var builder = ResponseEntity.ok().header("Cache-Control", "no-store");
    if (metadata.contentType() != null) {
      builder.header("Content-Type", metadata.contentType());
    }
    if (metadata.size() != null) {
      builder.contentLength(metadata.size());
    }
    if (metadata.lastModified() != null) {
      builder.lastModified(metadata.lastModified());
    }
    return builder.build();
  }

  @PutMapping
  public ResponseEntity<Void> upload(
      @RequestParam String key,
      @RequestParam String method,
      @RequestParam long expires,
      @RequestParam(required = false) String contentType,
      @RequestParam String signature,
      HttpServletRequest request)
      throws IOException {
    authorize(SignedUrlMethod.PUT, key, method, expires, contentType, signature);
    if (contentType != null && !sameMediaType(contentType, request.getContentType())) {
      log.warn("Signed upload for key={} sent Content-Type {}", key, request.getContentType());
      throw new SignedUrlRejectedException(
          "This URL only accepts uploads with Content-Type " + contentType);
    }

    var options =
        new UploadOptions(
            contentType != null ? contentType : request.getContentType(), null, false);
    storageProvider.upload(
        key, UploadSource.of(request.getInputStream(), request.getContentLengthLong()), options);
    return ResponseEntity.ok().build();
  }

  @DeleteMapping
  public ResponseEntity<Void> delete(
      @RequestParam String key,
      @RequestParam String method,
      @RequestParam long expires,
      @RequestParam(required = false) String contentType,
      @RequestParam String signature) {
    authorize(SignedUrlMethod.DELETE, key, method, expires, contentType, signature);
    storageProvider.delete(key);
    return ResponseEntity.noContent().build();
  }

  private void authorize(
      SignedUrlMethod expected,
      String key,
      String method,
      long expires,
      String contentType,
      String signature) {
    if (!expected.name().equals(method)
        || !storageProvider.verifySignedRequest(key, expected, expires, contentType, signature)) {
      log.warn("Rejected signed {} request for key={}", expected, key);
      throw new SignedUrlRejectedException("Signature is invalid or has expired");
    }
  }

  private static boolean sameMediaType(String expected, String actual) {
    if (actual == null) {
      return false;
    }
    try {
      return MediaType.parseMediaType(expected)
          .equalsTypeAndSubtype(MediaType.parseMediaType(actual));
    } catch (InvalidMediaTypeException e) {
      return false;
    }
  }
}
