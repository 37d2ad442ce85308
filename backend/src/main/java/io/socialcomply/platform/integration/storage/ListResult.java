package io.socialcomply.platform.integration.storage;

import java.util.List;

/** One listing page. A {@code null} {@code nextCursor} marks the end of the listing. */
public record ListResult(List<StorageObject> objects, String nextCursor) {

  public ListResult {
    objects = List.copyOf(objects);
    nextCursor = nextCursor == null || nextCursor.isEmpty() ? null : nextCursor;
  }

  public boolean hasMore() {
    return nextCursor != null;
  }
}
