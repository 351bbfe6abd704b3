package io.b2mash.b2b.isolation.storage;

import java.time.Instant;

public record BucketCreationResult(
    String bucketName, long quotaBytes, String endpoint, Instant createdAt, long durationMs) {}
