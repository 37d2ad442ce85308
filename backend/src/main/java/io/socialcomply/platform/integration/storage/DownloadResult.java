package io.socialcomply.platform.integration.storage;

import java.io.IOException;
import java.io.InputStream;

/** Live object stream plus its metadata. Callers must close it. */
public record DownloadResult(InputStream data, StorageMetadata metadata) implements AutoCloseable {

  @Override
  public void close() throws IOException {
    data.close();
  }
}
