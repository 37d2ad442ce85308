package io.socialcomply.platform.integration.storage;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * Upload payload: either an in-memory buffer or a readable stream. Adapters only ever call {@link
 * #openStream()}, so both variants take the same streaming path into the backend.
 */
public sealed interface UploadSource permits UploadSource.Bytes, UploadSource.Stream {

  /** Length in bytes, or {@code -1} when the stream length is not known up front. */
  long contentLength();

  InputStream openStream();

  static UploadSource of(byte[] content) {
    return new Bytes(content);
  }

  static UploadSource of(InputStream content, long contentLength) {
    return new Stream(content, contentLength);
  }

  static UploadSource of(InputStream content) {
    return new Stream(content, -1);
  }

  record Bytes(byte[] content) implements UploadSource {

    public Bytes {
      if (content == null) {
        throw new IllegalArgumentException("content must not be null");
      }
    }

    @Override
    public long contentLength() {
      return content.length;
    }

    @Override
    public InputStream openStream() {
      return new ByteArrayInputStream(content);
    }
  }

  record Stream(InputStream content, long contentLength) implements UploadSource {

    public Stream {
      if (content == null) {
        throw new IllegalArgumentException("content must not be null");
      }
    }

    @Override
    public InputStream openStream() {
      return content;
    }
  }
}
