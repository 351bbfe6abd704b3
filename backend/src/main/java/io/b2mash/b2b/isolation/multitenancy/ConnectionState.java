package io.b2mash.b2b.isolation.multitenancy;

/** Lifecycle of a borrowed connection's session namespace. */
public enum ConnectionState {
  /** Default namespace, eligible for reuse. */
  IDLE,
  /** Pointed at a tenant schema, mid-operation. */
  SCOPED,
  /** Reset could not be verified. Terminal: the connection must be destroyed. */
  CONTAMINATED
}
