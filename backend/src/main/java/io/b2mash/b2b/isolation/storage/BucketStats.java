package io.b2mash.b2b.isolation.storage;

import java.time.Instant;

/**
 * Usage snapshot for one tenant bucket.
 *
 * @param usagePercent {@code usedBytes} as a percentage of {@code quotaBytes}
 * @param lastModified most recent object modification, or null for an empty bucket
 */
public record BucketStats(
    long usedBytes,
    long totalObjects,
    long quotaBytes,
    double usagePercent,
    Instant lastModified) {}
