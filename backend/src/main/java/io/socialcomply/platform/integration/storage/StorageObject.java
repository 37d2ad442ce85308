package io.socialcomply.platform.integration.storage;

/** A logical key (namespace prefix included) together with its metadata. */
public record StorageObject(String key, StorageMetadata metadata) {}
