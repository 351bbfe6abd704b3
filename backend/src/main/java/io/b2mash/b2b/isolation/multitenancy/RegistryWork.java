package io.b2mash.b2b.isolation.multitenancy;

/** A unit of work run against a default-namespace connection. */
@FunctionalInterface
public interface RegistryWork<T> {

  T execute(RegistryHandle handle);
}
