package io.socialcomply.platform.integration.storage.local;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.head;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.socialcomply.platform.exception.GlobalExceptionHandler;
import io.socialcomply.platform.integration.storage.SignedUrlMethod;
import io.socialcomply.platform.integration.storage.SignedUrlOptions;
import io.socialcomply.platform.integration.storage.StorageProvider;
import io.socialcomply.platform.integration.storage.UploadOptions;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class LocalObjectControllerTest {

  private static final String PUBLIC_URL = "http://localhost:8080";
  private static final String SECRET = "controller-test-secret";

  @TempDir Path baseDir;

  private LocalStorageProvider provider;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    provider =
        new LocalStorageProvider(
            new LocalStorageConfig(baseDir, "public", ".private", PUBLIC_URL, SECRET),
            new ObjectMapper());
    provider.initialize();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new LocalObjectController(provider))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void signedUpload_thenSignedDownload_roundTrips() throws Exception {
    var uploadUrl = provider.getUploadUrl("batch-42");
    byte[] pdf = "%PDF-1.7 test".getBytes(StandardCharsets.UTF_8);

    mockMvc
        .perform(
            put(URI.create(uploadUrl.uploadUrl()))
                .contentType(MediaType.APPLICATION_PDF)
                .content(pdf))
        .andExpect(status().isOk());

    assertThat(provider.exists(uploadUrl.objectKey())).isTrue();
    String downloadUrl =
        provider.getSignedUrl(uploadUrl.objectKey(), SignedUrlOptions.get(60));
    mockMvc
        .perform(get(URI.create(downloadUrl)))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", "application/pdf"))
        .andExpect(header().string("Cache-Control", "no-store"))
        .andExpect(content().bytes(pdf));
  }

  @Test
  void tamperedSignature_isForbidden() throws Exception {
    provider.upload(".private/a.txt", "a".getBytes(StandardCharsets.UTF_8), null);
    String url = provider.getSignedUrl(".private/a.txt", SignedUrlOptions.get(60));
    String tampered = url.replace("key=.private%2Fa.txt", "key=.private%2Fb.txt");

    mockMvc
        .perform(get(URI.create(tampered)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.title").value("Signed URL rejected"));
  }

  @Test
  void urlSignedForGet_cannotBeUsedToDelete() throws Exception {
    provider.upload(".private/a.txt", "a".getBytes(StandardCharsets.UTF_8), null);
    String url = provider.getSignedUrl(".private/a.txt", SignedUrlOptions.get(60));

    mockMvc.perform(delete(URI.create(url))).andExpect(status().isForbidden());

    assertThat(provider.exists(".private/a.txt")).isTrue();
  }

  @Test
  void expiredUrl_isForbidden() throws Exception {
    provider.upload(".private/a.txt", "a".getBytes(StandardCharsets.UTF_8), null);
    var signer =
        new LocalSignedUrlSigner(SECRET.getBytes(StandardCharsets.UTF_8), PUBLIC_URL);
    String url =
        signer.signedUrl(
            ".private/a.txt", SignedUrlMethod.GET, Instant.now().minusSeconds(5), null);

    mockMvc.perform(get(URI.create(url))).andExpect(status().isForbidden());
  }

  @Test
  void signedPut_enforcesContentType() throws Exception {
    String url =
        provider.getSignedUrl(".private/photo.png", SignedUrlOptions.put(60, "image/png"));

    mockMvc
        .perform(put(URI.create(url)).contentType(MediaType.TEXT_PLAIN).content("nope"))
        .andExpect(status().isForbidden());
    assertThat(provider.exists(".private/photo.png")).isFalse();

    mockMvc
        .perform(put(URI.create(url)).contentType(MediaType.IMAGE_PNG).content(new byte[] {1, 2}))
        .andExpect(status().isOk());
    assertThat(provider.getMetadata(".private/photo.png").contentType()).isEqualTo("image/png");
  }

  @Test
  void signedDelete_removesObject() throws Exception {
    provider.upload(".private/old.txt", "x".getBytes(StandardCharsets.UTF_8), null);
    String url =
        provider.getSignedUrl(
            ".private/old.txt", new SignedUrlOptions(SignedUrlMethod.DELETE, 60, null));

    mockMvc.perform(delete(URI.create(url))).andExpect(status().isNoContent());

    assertThat(provider.exists(".private/old.txt")).isFalse();
  }

  @Test
  void signedHead_reportsMetadataWithoutBody() throws Exception {
    provider.upload(
        ".private/data.json",
        "{\"a\":1}".getBytes(StandardCharsets.UTF_8),
        UploadOptions.ofContentType("application/json"));
    String url =
        provider.getSignedUrl(
            ".private/data.json", new SignedUrlOptions(SignedUrlMethod.HEAD, 60, null));

    mockMvc
        .perform(head(URI.create(url)))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", "application/json"))
        .andExpect(header().longValue("Content-Length", 7));
  }

  @Test
  void validSignature_forMissingObject_isNotFoundProblem() throws Exception {
    String url = provider.getSignedUrl(".private/ghost.txt", SignedUrlOptions.get(60));

    mockMvc
        .perform(get(URI.create(url)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void constructor_rejectsNonLocalProvider() {
    assertThatThrownBy(() -> new LocalObjectController(mock(StorageProvider.class)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("requires the local storage provider");
  }
}
