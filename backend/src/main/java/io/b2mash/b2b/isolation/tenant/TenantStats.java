package io.b2mash.b2b.isolation.tenant;

import java.util.Map;

/**
 * Registry summary.
 *
 * @param recent tenants created in the last seven days
 */
public record TenantStats(
    long total, Map<TenantStatus, Long> byStatus, Map<Plan, Long> byPlan, long recent) {}
