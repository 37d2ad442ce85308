package io.socialcomply.platform.integration.storage;

public enum ObjectPermission {
  READ,
  WRITE,
  DELETE
}
