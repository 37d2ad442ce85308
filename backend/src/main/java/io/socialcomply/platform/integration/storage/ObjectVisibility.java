package io.socialcomply.platform.integration.storage;

public enum ObjectVisibility {
  PUBLIC,
  PRIVATE
}
