package io.socialcomply.platform.integration.storage;

/** The two visibility partitions of the logical key space. */
public enum Namespace {
  PUBLIC("public/", ObjectVisibility.PUBLIC),
  PRIVATE(".private/", ObjectVisibility.PRIVATE);

  private final String prefix;
  private final ObjectVisibility visibility;

  Namespace(String prefix, ObjectVisibility visibility) {
    this.prefix = prefix;
    this.visibility = visibility;
  }

  public String prefix() {
    return prefix;
  }

  public ObjectVisibility visibility() {
    return visibility;
  }

  public static Namespace of(ObjectVisibility visibility) {
    return visibility == ObjectVisibility.PUBLIC ? PUBLIC : PRIVATE;
  }

  /** Namespace named by the key's prefix, or {@code null} for an unprefixed key. */
  public static Namespace fromPrefix(String key) {
    if (key.startsWith(PRIVATE.prefix)) {
      return PRIVATE;
    }
    if (key.startsWith(PUBLIC.prefix)) {
      return PUBLIC;
    }
    return null;
  }
}
