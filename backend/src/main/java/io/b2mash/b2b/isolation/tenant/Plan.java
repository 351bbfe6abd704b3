package io.b2mash.b2b.isolation.tenant;

import java.util.Locale;
import java.util.Optional;

public enum Plan {
  FREE,
  BASIC,
  PRO,
  ENTERPRISE;

  /** Lower-case form used in bucket tags and external payloads. */
  public String slug() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Plan> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    for (Plan plan : values()) {
      if (plan.slug().equals(slug.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(plan);
      }
    }
    return Optional.empty();
  }
}
