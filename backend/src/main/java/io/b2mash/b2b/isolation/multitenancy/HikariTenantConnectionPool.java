package io.b2mash.b2b.isolation.multitenancy;

import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** {@link TenantConnectionPool} over the application Hikari pool. */
@Component
public class HikariTenantConnectionPool implements TenantConnectionPool {

  private static final Logger log = LoggerFactory.getLogger(HikariTenantConnectionPool.class);

  private final HikariDataSource dataSource;

  public HikariTenantConnectionPool(@Qualifier("appDataSource") HikariDataSource dataSource) {
    this.dataSource = dataSource;
  }

  @Override
  public Connection borrow() throws SQLException {
    return dataSource.getConnection();
  }

  @Override
  public void release(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to return connection to pool, evicting it", e);
      destroy(connection);
    }
  }

  /** Evicts from Hikari, which closes the physical connection instead of recycling it. */
  @Override
  public void destroy(Connection connection) {
    try {
      dataSource.evictConnection(connection);
    } catch (RuntimeException e) {
      log.error("Failed to evict connection from pool, aborting it", e);
      abort(connection);
    }
  }

  private void abort(Connection connection) {
    try {
      connection.abort(Runnable::run);
    } catch (SQLException e) {
      log.error("Failed to abort contaminated connection", e);
    }
  }
}
