package io.b2mash.b2b.isolation.provisioning;

/** Steps of {@link TenantProvisioningService#provisionTenant}, in execution order. */
public enum ProvisioningStep {
  REGISTRATION,
  SCHEMA,
  BUCKET,
  ACTIVATION
}
