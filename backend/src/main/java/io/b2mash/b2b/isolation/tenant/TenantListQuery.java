package io.b2mash.b2b.isolation.tenant;

import org.springframework.data.domain.Sort;

/**
 * Filters for the tenant overview listing.
 *
 * @param page 1-based page number
 * @param size page size, capped at {@link #MAX_SIZE}
 * @param search case-insensitive match on name or subdomain; null for none
 * @param status optional status filter
 * @param plan optional plan filter
 * @param sortBy one of createdAt, name, subdomain, plan
 * @param direction sort direction
 */
public record TenantListQuery(
    int page,
    int size,
    String search,
    TenantStatus status,
    Plan plan,
    String sortBy,
    Sort.Direction direction) {

  public static final int MAX_SIZE = 100;

  public TenantListQuery {
    page = Math.max(page, 1);
    size = size <= 0 ? 20 : Math.min(size, MAX_SIZE);
    sortBy = switch (sortBy == null ? "" : sortBy) {
      case "name", "subdomain", "plan" -> sortBy;
      default -> "createdAt";
    };
    direction = direction != null ? direction : Sort.Direction.DESC;
  }

  public static TenantListQuery firstPage() {
    return new TenantListQuery(1, 20, null, null, null, "createdAt", Sort.Direction.DESC);
  }
}
