package io.b2mash.b2b.isolation.tenant;

public record TenantDeletionResult(boolean success, String error) {

  public static TenantDeletionResult deleted() {
    return new TenantDeletionResult(true, null);
  }

  public static TenantDeletionResult refused(String error) {
    return new TenantDeletionResult(false, error);
  }
}
