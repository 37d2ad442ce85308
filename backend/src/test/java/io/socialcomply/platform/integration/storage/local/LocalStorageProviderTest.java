package io.socialcomply.platform.integration.storage.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.socialcomply.platform.integration.storage.DownloadOptions;
import io.socialcomply.platform.integration.storage.ListOptions;
import io.socialcomply.platform.integration.storage.ListResult;
import io.socialcomply.platform.integration.storage.ObjectAclPolicy;
import io.socialcomply.platform.integration.storage.ObjectPermission;
import io.socialcomply.platform.integration.storage.ObjectVisibility;
import io.socialcomply.platform.integration.storage.ServletResponseSink;
import io.socialcomply.platform.integration.storage.SignedUrlOptions;
import io.socialcomply.platform.integration.storage.StorageErrorCode;
import io.socialcomply.platform.integration.storage.StorageException;
import io.socialcomply.platform.integration.storage.StorageObject;
import io.socialcomply.platform.integration.storage.UploadOptions;
import io.socialcomply.platform.integration.storage.UploadSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockHttpServletResponse;

class LocalStorageProviderTest {

  private static final String PUBLIC_URL = "http://localhost:8080";

  @TempDir Path baseDir;

  private LocalStorageProvider provider;

  @BeforeEach
  void setUp() {
    provider = newProvider(PUBLIC_URL);
    provider.initialize();
  }

  private LocalStorageProvider newProvider(String publicUrl) {
    return new LocalStorageProvider(
        new LocalStorageConfig(baseDir, "public", ".private", publicUrl, "test-secret"),
        new ObjectMapper());
  }

  private static byte[] bytes(String content) {
    return content.getBytes(StandardCharsets.UTF_8);
  }

  private String read(String key) throws IOException {
    try (var result = provider.download(key)) {
      return new String(result.data().readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  void upload_thenDownload_returnsSameBytesAndContentType() throws IOException {
    provider.upload(
        ".private/reports/q1.csv",
        bytes("a,b\n1,2\n"),
        new UploadOptions("text/csv", Map.of("owner", "ops"), false));

    try (var result = provider.download(".private/reports/q1.csv")) {
      assertThat(result.data().readAllBytes()).isEqualTo(bytes("a,b\n1,2\n"));
      assertThat(result.metadata().contentType()).isEqualTo("text/csv");
      assertThat(result.metadata().size()).isEqualTo(8L);
      assertThat(result.metadata().lastModified()).isNotNull();
      assertThat(result.metadata().customMetadata()).containsEntry("owner", "ops");
    }
  }

  @Test
  void upload_streamOfUnknownLength_isStoredCompletely() throws IOException {
    byte[] payload = new byte[200_000];
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) i;
    }

    provider.upload(
        ".private/blob.bin",
        UploadSource.of(new ByteArrayInputStream(payload)),
        UploadOptions.defaults());

    try (var result = provider.download(".private/blob.bin")) {
      assertThat(result.data().readAllBytes()).isEqualTo(payload);
      assertThat(result.metadata().contentType()).isEqualTo("application/octet-stream");
    }
  }

  @Test
  void upload_writesObjectAndSidecarUnderNamespaceDirectories() {
    provider.upload("public/logo.png", bytes("png"), UploadOptions.ofContentType("image/png"));
    provider.upload(".private/doc.pdf", bytes("pdf"), UploadOptions.defaults());

    assertThat(baseDir.resolve("public/logo.png")).exists();
    assertThat(baseDir.resolve("public/logo.png.meta.json")).exists();
    assertThat(baseDir.resolve(".private/doc.pdf")).exists();
    assertThat(baseDir.resolve(".private/doc.pdf.meta.json")).exists();
  }

  @Test
  void upload_unprefixedPublicObject_landsInPublicDirectory() throws IOException {
    provider.upload("avatar.png", bytes("img"), UploadOptions.publicObject("image/png"));

    assertThat(baseDir.resolve("public/avatar.png")).exists();
    assertThat(read("avatar.png")).isEqualTo("img");
    assertThat(provider.getPublicUrl("avatar.png"))
        .contains("http://localhost:8080/public/avatar.png");
    assertThat(provider.canAccess("avatar.png", null, ObjectPermission.READ)).isTrue();
  }

  @Test
  void upload_unprefixedKey_reuploadedPrivately_removesPublicCopy() throws IOException {
    provider.upload("avatar.png", bytes("old"), UploadOptions.publicObject("image/png"));
    provider.upload("avatar.png", bytes("new"), UploadOptions.ofContentType("image/png"));

    assertThat(baseDir.resolve("public/avatar.png")).doesNotExist();
    assertThat(read("avatar.png")).isEqualTo("new");
    assertThat(provider.getPublicUrl("avatar.png")).isEmpty();
  }

  @Test
  void getPublicUrl_followsNamespace() {
    provider.upload("public/a.png", bytes("a"), UploadOptions.defaults());
    provider.upload(".private/b.png", bytes("b"), UploadOptions.defaults());

    assertThat(provider.getPublicUrl("public/a.png"))
        .contains("http://localhost:8080/public/a.png");
    assertThat(provider.getPublicUrl(".private/b.png")).isEmpty();
  }

  @Test
  void getPublicUrl_neverThrows() {
    assertThat(provider.getPublicUrl(null)).isEmpty();
    assertThat(provider.getPublicUrl("public/../escape")).isEmpty();
    assertThat(newProvider(null).getPublicUrl("public/a.png")).isEmpty();
  }

  @Test
  void delete_isIdempotent() {
    provider.upload(".private/tmp.txt", bytes("x"), UploadOptions.defaults());

    provider.delete(".private/tmp.txt");
    provider.delete(".private/tmp.txt");

    assertThat(provider.exists(".private/tmp.txt")).isFalse();
    assertThat(baseDir.resolve(".private/tmp.txt.meta.json")).doesNotExist();
  }

  @Test
  void download_missingKey_throwsNotFound() {
    assertThatThrownBy(() -> provider.download(".private/missing"))
        .isInstanceOf(StorageException.class)
        .hasMessage("Object not found: .private/missing")
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.NOT_FOUND);
  }

  @Test
  void getMetadata_missingKey_throwsNotFound() {
    assertThatThrownBy(() -> provider.getMetadata("public/missing"))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.NOT_FOUND);
  }

  @Test
  void operations_beforeInitialize_failWithConfigurationError() {
    var uninitialized = newProvider(PUBLIC_URL);

    assertThatThrownBy(() -> uninitialized.download(".private/a"))
        .isInstanceOf(StorageException.class)
        .hasMessage(
            "Local Filesystem storage provider is not initialized. Call initialize() first.")
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.CONFIGURATION_ERROR);
    assertThat(uninitialized.healthCheck()).isFalse();
  }

  @Test
  void initialize_twice_isRejected() {
    assertThatThrownBy(() -> provider.initialize())
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("already initialized");
  }

  @Test
  void healthCheck_afterInitialize_isTrue() {
    assertThat(provider.healthCheck()).isTrue();
  }

  @Test
  void keys_thatEscapeOrCollideWithSidecars_areInvalid() {
    assertThatThrownBy(
            () -> provider.upload("public/../.private/x", bytes("x"), UploadOptions.defaults()))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.INVALID_KEY);
    assertThatThrownBy(
            () -> provider.upload(".private/a.meta.json", bytes("x"), UploadOptions.defaults()))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.INVALID_KEY);
  }

  @Test
  void setVisibility_isReportedByAclPolicy() {
    provider.upload(".private/contract.pdf", bytes("pdf"), UploadOptions.defaults());
    assertThat(provider.getAclPolicy(".private/contract.pdf"))
        .map(ObjectAclPolicy::visibility)
        .contains(ObjectVisibility.PRIVATE);

    provider.setVisibility(".private/contract.pdf", ObjectVisibility.PUBLIC);

    assertThat(provider.supportsInPlaceVisibilityChange()).isTrue();
    assertThat(provider.getAclPolicy(".private/contract.pdf"))
        .map(ObjectAclPolicy::visibility)
        .contains(ObjectVisibility.PUBLIC);
    assertThat(provider.canAccess(".private/contract.pdf", null, ObjectPermission.READ)).isTrue();
  }

  @Test
  void setVisibility_missingObject_throwsNotFound() {
    assertThatThrownBy(() -> provider.setVisibility(".private/nope", ObjectVisibility.PUBLIC))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.NOT_FOUND);
  }

  @Test
  void setVisibility_racingSetAclPolicy_neverLosesEitherUpdate() throws Exception {
    var executor = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 100; round++) {
        String key = ".private/race/doc-" + round;
        provider.upload(key, bytes("doc"), UploadOptions.defaults());
        var barrier = new CyclicBarrier(2);

        Future<?> visibility =
            executor.submit(
                () -> {
                  barrier.await();
                  provider.setVisibility(key, ObjectVisibility.PUBLIC);
                  return null;
                });
        Future<?> policy =
            executor.submit(
                () -> {
                  barrier.await();
                  provider.setAclPolicy(
                      key,
                      new ObjectAclPolicy(ObjectVisibility.PRIVATE, List.of("alice"), List.of()));
                  return null;
                });
        visibility.get(10, TimeUnit.SECONDS);
        policy.get(10, TimeUnit.SECONDS);

        assertThat(provider.getAclPolicy(key))
            .hasValueSatisfying(
                result -> assertThat(result.allowedUsers()).as(key).containsExactly("alice"));
      }
    } finally {
      executor.shutdown();
    }
    assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void upload_overPublishedObject_resetsPolicyToUploadVisibility() {
    provider.upload(".private/doc.pdf", bytes("v1"), UploadOptions.defaults());
    provider.setVisibility(".private/doc.pdf", ObjectVisibility.PUBLIC);

    provider.upload(".private/doc.pdf", bytes("v2"), UploadOptions.defaults());

    assertThat(provider.canAccess(".private/doc.pdf", null, ObjectPermission.READ)).isFalse();
  }

  @Test
  void canAccess_privateObject_deniesByDefault_andAllowsListedUsers() {
    provider.upload(".private/evidence.jpg", bytes("jpg"), UploadOptions.defaults());

    assertThat(provider.canAccess(".private/evidence.jpg", "user-1", ObjectPermission.READ))
        .isFalse();
    assertThat(provider.canAccess(".private/evidence.jpg", null, ObjectPermission.READ)).isFalse();

    provider.setAclPolicy(
        ".private/evidence.jpg",
        new ObjectAclPolicy(ObjectVisibility.PRIVATE, List.of("user-1"), List.of("auditor")));

    assertThat(provider.canAccess(".private/evidence.jpg", "user-1", ObjectPermission.WRITE))
        .isTrue();
    assertThat(provider.canAccess(".private/evidence.jpg", "auditor", ObjectPermission.READ))
        .isFalse();
  }

  @Test
  void canAccess_missingObject_isDenied() {
    assertThat(provider.canAccess(".private/ghost", "user-1", ObjectPermission.READ)).isFalse();
  }

  @Test
  void list_250Objects_in5PagesOf50_withoutRepeats() {
    for (int i = 0; i < 250; i++) {
      String key = String.format(".private/batch/item-%03d.txt", i);
      provider.upload(key, bytes("v" + i), UploadOptions.defaults());
    }
    provider.upload(".private/other/skip.txt", bytes("x"), UploadOptions.defaults());

    var seen = new HashSet<String>();
    int pages = 0;
    var options = new ListOptions(".private/batch/", 50, null);
    ListResult page;
    do {
      page = provider.list(options);
      pages++;
      assertThat(page.objects()).hasSize(50);
      for (StorageObject object : page.objects()) {
        assertThat(object.key()).startsWith(".private/batch/").doesNotEndWith(".meta.json");
        assertThat(seen.add(object.key())).as("repeated %s", object.key()).isTrue();
      }
      options = options.next(page.nextCursor());
    } while (page.hasMore());

    assertThat(pages).isEqualTo(5);
    assertThat(seen).hasSize(250);
  }

  @Test
  void list_publicPrefix_readsPublicDirectory() {
    provider.upload("public/site/a.png", bytes("a"), UploadOptions.defaults());
    provider.upload(".private/site/b.png", bytes("b"), UploadOptions.defaults());

    var result = provider.list(ListOptions.prefix("public/site/"));

    assertThat(result.objects())
        .extracting(StorageObject::key)
        .containsExactly("public/site/a.png");
    assertThat(result.nextCursor()).isNull();
  }

  @Test
  void list_malformedCursor_isInvalidKey() {
    assertThatThrownBy(() -> provider.list(new ListOptions(".private/", 10, "***")))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.INVALID_KEY);
  }

  @Test
  void copy_acrossNamespaces_keepsAllowListAndTakesDestinationVisibility() throws IOException {
    provider.upload(".private/draft.pdf", bytes("draft"), UploadOptions.defaults());
    provider.setAclPolicy(
        ".private/draft.pdf",
        new ObjectAclPolicy(ObjectVisibility.PRIVATE, List.of("author"), List.of()));

    provider.copy(".private/draft.pdf", "public/draft.pdf");

    assertThat(read("public/draft.pdf")).isEqualTo("draft");
    assertThat(provider.getAclPolicy("public/draft.pdf"))
        .contains(new ObjectAclPolicy(ObjectVisibility.PUBLIC, List.of("author"), List.of()));
    assertThat(provider.getAclPolicy(".private/draft.pdf"))
        .map(ObjectAclPolicy::visibility)
        .contains(ObjectVisibility.PRIVATE);
    assertThat(provider.getPublicUrl("public/draft.pdf")).isPresent();
  }

  @Test
  void copy_missingSource_throwsNotFound() {
    assertThatThrownBy(() -> provider.copy(".private/none", "public/none"))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.NOT_FOUND);
  }

  @Test
  void streamToResponse_setsHeadersAndWritesBody() {
    provider.upload(
        ".private/page.html", bytes("<p>hi</p>"), UploadOptions.ofContentType("text/html"));
    var response = new MockHttpServletResponse();

    provider.streamToResponse(
        ".private/page.html", new ServletResponseSink(response), DownloadOptions.cacheFor(60));

    assertThat(response.getHeader("Content-Type")).isEqualTo("text/html");
    assertThat(response.getHeader("Content-Length")).isEqualTo("9");
    assertThat(response.getHeader("Cache-Control")).isEqualTo("private, max-age=60");
    assertThat(response.getContentAsByteArray()).isEqualTo(bytes("<p>hi</p>"));
  }

  @Test
  void streamToResponse_withoutCaching_isNoStore() {
    provider.upload(".private/x.bin", bytes("x"), UploadOptions.defaults());
    var response = new MockHttpServletResponse();

    provider.streamToResponse(
        ".private/x.bin", new ServletResponseSink(response), DownloadOptions.noStore());

    assertThat(response.getHeader("Cache-Control")).isEqualTo("no-store");
    assertThat(response.getHeader("Content-Type")).isEqualTo("application/octet-stream");
  }

  @Test
  void getSignedUrl_withoutPublicUrl_isConfigurationError() {
    var withoutUrl = newProvider(null);
    withoutUrl.initialize();

    assertThatThrownBy(() -> withoutUrl.getSignedUrl(".private/a", SignedUrlOptions.get(60)))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("LOCAL_STORAGE_PUBLIC_URL")
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.CONFIGURATION_ERROR);
  }

  @Test
  void getUploadUrl_issuesPrivateKeyAndSignedPutUrl() {
    var uploadUrl = provider.getUploadUrl("batch-42");

    assertThat(uploadUrl.objectKey()).startsWith(".private/batch-42/");
    assertThat(uploadUrl.uploadUrl())
        .startsWith("http://localhost:8080/storage/local/objects?key=")
        .contains("method=PUT")
        .contains("signature=");
    assertThat(uploadUrl.expiresAt()).isAfter(Instant.now().plusSeconds(890));
  }

  @Test
  void searchPublicObject_findsRelativePathInPublicNamespace() {
    provider.upload("public/docs/guide.pdf", bytes("guide"), UploadOptions.defaults());

    assertThat(provider.searchPublicObject("/docs/guide.pdf"))
        .map(StorageObject::key)
        .contains("public/docs/guide.pdf");
    assertThat(provider.searchPublicObject("docs/missing.pdf")).isEmpty();
  }

  @Test
  void normalizeEntityPath_translatesUrlsAndFilesystemPaths() {
    assertThat(provider.normalizeEntityPath("http://localhost:8080/public/img/a.png"))
        .isEqualTo("public/img/a.png");
    assertThat(
            provider.normalizeEntityPath(
                baseDir.resolve(".private/docs/b.pdf").toAbsolutePath().toString()))
        .isEqualTo(".private/docs/b.pdf");
    assertThat(provider.normalizeEntityPath("Some Free Text")).isEqualTo("Some Free Text");
  }

  @Test
  void sidecar_isPlainJson() throws IOException {
    provider.upload(".private/a.txt", bytes("a"), UploadOptions.ofContentType("text/plain"));

    String json = Files.readString(baseDir.resolve(".private/a.txt.meta.json"));

    assertThat(json)
        .contains("\"contentType\":\"text/plain\"")
        .contains("\"visibility\":\"PRIVATE\"");
  }
}
