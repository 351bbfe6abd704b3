package io.b2mash.b2b.isolation.multitenancy;

import java.util.Objects;

/**
 * A schema name that has passed {@link IdentifierSanitizer}. The only type {@link
 * SearchPathCommands} accepts, so a raw caller string can never reach a session command.
 */
public final class TenantSchema {

  private final String name;

  private TenantSchema(String name) {
    this.name = name;
  }

  public static TenantSchema forSubdomain(String subdomain) {
    return new TenantSchema(TenantNamespaces.schemaName(subdomain));
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TenantSchema other && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
