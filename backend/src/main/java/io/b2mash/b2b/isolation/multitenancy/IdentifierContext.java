package io.b2mash.b2b.isolation.multitenancy;

/** Where a sanitized token will be used. Each context has its own length window. */
public enum IdentifierContext {
  /** Postgres schema names: the token is prefixed with {@code tenant_}. */
  SCHEMA(3, 50),
  /** DNS labels (subdomains, bucket name bases). */
  DNS(3, 63);

  private final int minLength;
  private final int maxLength;

  IdentifierContext(int minLength, int maxLength) {
    this.minLength = minLength;
    this.maxLength = maxLength;
  }

  public int minLength() {
    return minLength;
  }

  public int maxLength() {
    return maxLength;
  }
}
