package io.socialcomply.platform.integration.storage;

/** Closed set of failure categories a {@link StorageProvider} may report. */
public enum StorageErrorCode {
  NOT_FOUND,
  PERMISSION_DENIED,
  INVALID_KEY,
  UPLOAD_FAILED,
  DOWNLOAD_FAILED,
  DELETE_FAILED,
  CONNECTION_ERROR,
  CONFIGURATION_ERROR,
  PROVIDER_UNAVAILABLE
}
