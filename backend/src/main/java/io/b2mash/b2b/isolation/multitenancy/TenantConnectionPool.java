package io.b2mash.b2b.isolation.multitenancy;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * The shared pool of physical connections. Injected into {@link TenantConnectionBroker} so tests
 * can substitute a pool of size one.
 */
public interface TenantConnectionPool {

  /** Borrows a connection for exclusive use by the caller. */
  Connection borrow() throws SQLException;

  /** Returns a connection whose session is back on the default namespace. */
  void release(Connection connection);

  /** Closes the physical connection. It must never be handed out again. */
  void destroy(Connection connection);
}
