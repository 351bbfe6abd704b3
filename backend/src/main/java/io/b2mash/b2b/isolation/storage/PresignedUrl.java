package io.b2mash.b2b.isolation.storage;

import java.time.Instant;

/** A time-limited URL for a single object, generated by S3 presigning. */
public record PresignedUrl(String url, Instant expiresAt) {}
