package io.b2mash.b2b.isolation.multitenancy;

/** A unit of work run against a tenant-scoped connection. */
@FunctionalInterface
public interface TenantWork<T> {

  T execute(TenantHandle handle);
}
