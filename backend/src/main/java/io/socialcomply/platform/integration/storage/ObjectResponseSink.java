package io.socialcomply.platform.integration.storage;

import java.io.IOException;
import java.io.OutputStream;

/** Transport-level destination for {@link StorageProvider#streamToResponse}. */
public interface ObjectResponseSink {

  void setHeader(String name, String value);

  /** Body stream; obtained only after all headers are set. */
  OutputStream body() throws IOException;
}
