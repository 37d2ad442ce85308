package io.socialcomply.platform.integration.storage;

import java.time.Instant;

/** A presigned {@code PUT} URL together with the logical key the object will be stored under. */
public record UploadUrl(String uploadUrl, String objectKey, Instant expiresAt) {}
