package io.socialcomply.platform.integration.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StorageKeysTest {

  @Test
  void namespaceOf_prefixedKeys_resolveToTheirNamespace() {
    assertThat(StorageKeys.namespaceOf("public/logo.png", Namespace.PRIVATE))
        .isEqualTo(Namespace.PUBLIC);
    assertThat(StorageKeys.namespaceOf(".private/report.pdf", Namespace.PUBLIC))
        .isEqualTo(Namespace.PRIVATE);
  }

  @Test
  void namespaceOf_unprefixedKey_usesDefault() {
    assertThat(StorageKeys.namespaceOf("evidence/photo.jpg", Namespace.PRIVATE))
        .isEqualTo(Namespace.PRIVATE);
    assertThat(StorageKeys.namespaceOf("evidence/photo.jpg", Namespace.PUBLIC))
        .isEqualTo(Namespace.PUBLIC);
  }

  @Test
  void stripNamespace_removesOnlyTheLeadingPrefix() {
    assertThat(StorageKeys.stripNamespace(".private/a/public/b")).isEqualTo("a/public/b");
    assertThat(StorageKeys.stripNamespace("public/x.txt")).isEqualTo("x.txt");
    assertThat(StorageKeys.stripNamespace("plain/x.txt")).isEqualTo("plain/x.txt");
  }

  @Test
  void withNamespace_prependsPrefix() {
    assertThat(StorageKeys.withNamespace(Namespace.PUBLIC, "a/b.png")).isEqualTo("public/a/b.png");
    assertThat(StorageKeys.withNamespace(Namespace.PRIVATE, "a/b.png"))
        .isEqualTo(".private/a/b.png");
  }

  @Test
  void isPublicKey_and_isPrivateKey_lookAtPrefixOnly() {
    assertThat(StorageKeys.isPublicKey("public/a")).isTrue();
    assertThat(StorageKeys.isPublicKey("publication/a")).isFalse();
    assertThat(StorageKeys.isPrivateKey(".private/a")).isTrue();
    assertThat(StorageKeys.isPrivateKey("private/a")).isFalse();
    assertThat(StorageKeys.isPublicKey(null)).isFalse();
  }

  @Test
  void validate_rejectsBlankKey() {
    assertThatThrownBy(() -> StorageKeys.validate("  ", "test"))
        .isInstanceOf(StorageException.class)
        .extracting(e -> ((StorageException) e).getCode())
        .isEqualTo(StorageErrorCode.INVALID_KEY);
  }

  @Test
  void validate_rejectsParentSegments() {
    assertThatThrownBy(() -> StorageKeys.validate(".private/../public/secret", "test"))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("'..'");
  }

  @Test
  void validate_rejectsBackslashAndNul() {
    assertThatThrownBy(() -> StorageKeys.validate("a\\b", "test"))
        .isInstanceOf(StorageException.class);
    assertThatThrownBy(() -> StorageKeys.validate("a\0b", "test"))
        .isInstanceOf(StorageException.class);
  }

  @Test
  void validate_acceptsDotsInsideNames() {
    StorageKeys.validate(".private/report..v2.pdf", "test");
    StorageKeys.validate("public/.well-known/file", "test");
  }

  @Test
  void newUploadKey_isPrivateAndUnique() {
    String first = StorageKeys.newUploadKey("batch-42");
    String second = StorageKeys.newUploadKey("batch-42");

    assertThat(first).startsWith(".private/batch-42/").isNotEqualTo(second);
    assertThat(first.substring(".private/batch-42/".length()))
        .matches("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}");
  }

  @Test
  void newUploadKey_withoutPrefix_isDirectlyUnderPrivateNamespace() {
    assertThat(StorageKeys.newUploadKey(null)).matches("\\.private/[0-9a-f-]{36}");
    assertThat(StorageKeys.newUploadKey("  ")).matches("\\.private/[0-9a-f-]{36}");
  }

  @Test
  void newUploadKey_trimsSlashesAndExistingNamespace() {
    assertThat(StorageKeys.newUploadKey("/uploads/")).startsWith(".private/uploads/");
    assertThat(StorageKeys.newUploadKey("public/avatars")).startsWith(".private/avatars/");
  }

  @Test
  void sanitize_lowercasesReplacesAndCollapses() {
    assertThat(StorageKeys.sanitize("//Evidence Files//Site #3/IMG 01.JPG/"))
        .isEqualTo("evidence-files/site--3/img-01.jpg");
  }
}
