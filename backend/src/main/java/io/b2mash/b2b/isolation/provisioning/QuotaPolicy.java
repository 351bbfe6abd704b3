package io.b2mash.b2b.isolation.provisioning;

import io.b2mash.b2b.isolation.tenant.Plan;
import io.b2mash.b2b.isolation.tenant.TenantRegistry;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Plan limits and subdomain rules. The limit lookups are static tables; only {@link
 * #validateSubdomain} consults the registry. Quota checks are advisory: nothing here blocks a
 * write.
 */
@Component
public class QuotaPolicy {

  public static final long GIB = 1024L * 1024 * 1024;

  static final int SUBDOMAIN_MIN_LENGTH = 3;
  static final int SUBDOMAIN_MAX_LENGTH = 30;

  private static final Pattern SUBDOMAIN_PATTERN = Pattern.compile("^[a-z0-9-]+$");

  static final Set<String> RESERVED_SUBDOMAINS =
      Set.of(
          "admin", "api", "www", "app", "mail", "static", "assets", "cdn", "status", "support",
          "help", "auth", "billing", "dashboard", "public");

  /** Available on every plan. */
  static final Set<String> BASE_FEATURES = Set.of("products", "orders", "basic_analytics");

  private static final Map<Plan, PlanLimits> LIMITS = new EnumMap<>(Plan.class);

  static {
    LIMITS.put(
        Plan.FREE,
        new PlanLimits(10, GIB, 1, 1, BASE_FEATURES, false, 50, false, false));
    LIMITS.put(
        Plan.BASIC,
        new PlanLimits(
            100, 10 * GIB, 3, 1, withBase("coupons"), false, 500, true, false));
    LIMITS.put(
        Plan.PRO,
        new PlanLimits(
            1_000,
            100 * GIB,
            10,
            3,
            withBase("api_access", "webhooks", "priority_support", "multi_warehouse"),
            false,
            5_000,
            true,
            true));
    LIMITS.put(
        Plan.ENTERPRISE,
        new PlanLimits(999_999, 1_000 * GIB, 99, 10, Set.of(), true, 999_999, true, true));
  }

  private final TenantRegistry tenantRegistry;

  public QuotaPolicy(TenantRegistry tenantRegistry) {
    this.tenantRegistry = tenantRegistry;
  }

  /** Limits for {@code plan}; a null plan gets the FREE limits. */
  public static PlanLimits limitsFor(Plan plan) {
    return LIMITS.get(plan != null ? plan : Plan.FREE);
  }

  public static long storageQuotaBytes(Plan plan) {
    return limitsFor(plan).maxStorageBytes();
  }

  /** Enterprise allows everything; other plans consult their allow-list and deny the rest. */
  public static boolean isFeatureAllowed(Plan plan, String feature) {
    var limits = limitsFor(plan);
    return limits.allFeatures() || (feature != null && limits.allowedFeatures().contains(feature));
  }

  /** True while {@code currentUsage} is strictly below the plan's limit for {@code resource}. */
  public static boolean checkQuota(long currentUsage, Plan plan, QuotaResource resource) {
    var limits = limitsFor(plan);
    long limit =
        switch (resource) {
          case PRODUCTS -> limits.maxProducts();
          case STORAGE_BYTES -> limits.maxStorageBytes();
          case STAFF_USERS -> limits.maxStaffUsers();
          case ORDERS_PER_MONTH -> limits.maxOrdersPerMonth();
        };
    return currentUsage < limit;
  }

  /**
   * Format rules first (length, characters, reserved words), then a case-insensitive registry
   * lookup. A subdomain held by a tenant in any status is unavailable.
   */
  public SubdomainAvailability validateSubdomain(String candidate) {
    var format = checkFormat(candidate);
    if (!format.available()) {
      return format;
    }
    if (tenantRegistry.getBySubdomain(candidate).isPresent()) {
      return SubdomainAvailability.rejected("Subdomain already taken");
    }
    return SubdomainAvailability.ok();
  }

  static SubdomainAvailability checkFormat(String candidate) {
    if (candidate == null
        || candidate.length() < SUBDOMAIN_MIN_LENGTH
        || candidate.length() > SUBDOMAIN_MAX_LENGTH) {
      return SubdomainAvailability.rejected(
          "Must be between "
              + SUBDOMAIN_MIN_LENGTH
              + " and "
              + SUBDOMAIN_MAX_LENGTH
              + " characters");
    }
    if (!SUBDOMAIN_PATTERN.matcher(candidate).matches()) {
      return SubdomainAvailability.rejected("Only lowercase letters, numbers, and hyphens");
    }
    if (RESERVED_SUBDOMAINS.contains(candidate)) {
      return SubdomainAvailability.rejected("Reserved word");
    }
    return SubdomainAvailability.ok();
  }

  private static Set<String> withBase(String... features) {
    var all = new HashSet<>(BASE_FEATURES);
    all.addAll(Set.of(features));
    return all;
  }
}
