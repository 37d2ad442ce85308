package io.socialcomply.platform.integration.storage;

/** HTTP method a signed URL is valid for. */
public enum SignedUrlMethod {
  GET,
  PUT,
  DELETE,
  HEAD
}
