package io.b2mash.b2b.isolation.provisioning;

import java.util.Set;

/**
 * Compiled limits for one plan. Read-only at runtime; see {@link QuotaPolicy#limitsFor}.
 *
 * @param allowedFeatures explicit allow-list; ignored for plans where {@code allFeatures} is set
 */
public record PlanLimits(
    long maxProducts,
    long maxStorageBytes,
    int maxStaffUsers,
    int maxTenantsPerOrg,
    Set<String> allowedFeatures,
    boolean allFeatures,
    long maxOrdersPerMonth,
    boolean customDomain,
    boolean prioritySupport) {

  public PlanLimits {
    allowedFeatures = Set.copyOf(allowedFeatures);
  }
}
