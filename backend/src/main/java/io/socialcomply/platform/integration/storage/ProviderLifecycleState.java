package io.socialcomply.platform.integration.storage;

/** Progress of a provider type from registration to process-wide use. */
public enum ProviderLifecycleState {
  UNREGISTERED,
  REGISTERED,
  CONSTRUCTED,
  HEALTHY,
  ACTIVE
}
