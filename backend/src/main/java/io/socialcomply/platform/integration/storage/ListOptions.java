package io.socialcomply.platform.integration.storage;

/**
 * @param prefix logical key prefix; its namespace selects the bucket (private when absent)
 * @param maxResults page size, {@link #DEFAULT_MAX_RESULTS} when {@code null}
 * @param cursor opaque continuation value from a previous {@link ListResult#nextCursor()}
 */
public record ListOptions(String prefix, Integer maxResults, String cursor) {

  public static final int DEFAULT_MAX_RESULTS = 1000;

  public ListOptions {
    if (maxResults != null && maxResults <= 0) {
      throw new IllegalArgumentException("maxResults must be positive");
    }
  }

  public static ListOptions prefix(String prefix) {
    return new ListOptions(prefix, null, null);
  }

  public int effectiveMaxResults() {
    return maxResults != null ? maxResults : DEFAULT_MAX_RESULTS;
  }

  public String effectivePrefix() {
    return prefix != null ? prefix : "";
  }

  public ListOptions next(String nextCursor) {
    return new ListOptions(prefix, maxResults, nextCursor);
  }
}
