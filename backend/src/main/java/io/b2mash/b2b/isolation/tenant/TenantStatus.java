package io.b2mash.b2b.isolation.tenant;

public enum TenantStatus {
  ACTIVE,
  SUSPENDED,
  PENDING,
  MAINTENANCE
}
