package io.b2mash.b2b.isolation.multitenancy;

import java.util.Locale;
import java.util.UUID;

/**
 * Derives schema and bucket names from stable tenant attributes. Names are never stored, so the
 * name used to create a resource is always the name used to address it later.
 */
public final class TenantNamespaces {

  public static final String SCHEMA_PREFIX = "tenant_";
  public static final String BUCKET_PREFIX = "tenant-";
  public static final String BUCKET_SUFFIX = "-assets";

  private TenantNamespaces() {}

  public static String schemaName(String subdomain) {
    return SCHEMA_PREFIX + IdentifierSanitizer.sanitize(subdomain, IdentifierContext.SCHEMA);
  }

  public static String bucketName(UUID tenantId) {
    if (tenantId == null) {
      throw new IllegalArgumentException("Tenant id must not be null");
    }
    String hex = tenantId.toString().replace("-", "").toLowerCase(Locale.ROOT);
    return BUCKET_PREFIX + hex + BUCKET_SUFFIX;
  }
}
