package io.b2mash.b2b.isolation.provisioning;

public record SchemaVerification(String schemaName, boolean exists, int tableCount) {}
