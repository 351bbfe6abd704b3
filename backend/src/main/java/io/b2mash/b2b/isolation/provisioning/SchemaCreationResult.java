package io.b2mash.b2b.isolation.provisioning;

import java.time.Instant;

public record SchemaCreationResult(String schemaName, Instant createdAt, long durationMs) {}
