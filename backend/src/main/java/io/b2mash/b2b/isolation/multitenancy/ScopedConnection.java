package io.b2mash.b2b.isolation.multitenancy;

import io.b2mash.b2b.isolation.exception.CleanupFailureException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A borrowed connection together with the state of its session namespace. Transitions are
 * IDLE -> SCOPED -> IDLE or CONTAMINATED; CONTAMINATED never leaves.
 */
final class ScopedConnection {

  private final Connection connection;
  private final String defaultSchema;
  private final int cleanupTimeoutSeconds;
  private ConnectionState state = ConnectionState.IDLE;
  private TenantSchema schema;

  ScopedConnection(Connection connection, String defaultSchema, int cleanupTimeoutSeconds) {
    this.connection = connection;
    this.defaultSchema = defaultSchema;
    this.cleanupTimeoutSeconds = cleanupTimeoutSeconds;
  }

  Connection connection() {
    return connection;
  }

  ConnectionState state() {
    return state;
  }

  TenantSchema schema() {
    return schema;
  }

  /**
   * Points the session at {@code tenantSchema}. The state moves to SCOPED before the command runs:
   * a half-applied switch must go through the same reset-or-destroy path as a successful one.
   */
  void enterScope(TenantSchema tenantSchema) throws SQLException {
    requireState(ConnectionState.IDLE);
    this.schema = tenantSchema;
    this.state = ConnectionState.SCOPED;
    execute(SearchPathCommands.scopeTo(tenantSchema, defaultSchema));
  }

  /** Resets the search path and verifies it. Only a verified reset returns the state to IDLE. */
  void exitScope() throws SQLException {
    requireState(ConnectionState.SCOPED);
    execute(SearchPathCommands.resetTo(defaultSchema));
    checkSearchPath();
    this.schema = null;
    this.state = ConnectionState.IDLE;
  }

  /** Asserts that an idle connection really is on the default namespace. */
  void verifyDefault() throws SQLException {
    requireState(ConnectionState.IDLE);
    checkSearchPath();
  }

  void markContaminated() {
    this.state = ConnectionState.CONTAMINATED;
  }

  private void checkSearchPath() throws SQLException {
    String searchPath = currentSearchPath();
    if (!defaultSchema.equals(normalize(searchPath))) {
      throw new CleanupFailureException(
          "search_path is '" + searchPath + "', expected '" + defaultSchema + "'");
    }
  }

  private String currentSearchPath() throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      applyTimeout(stmt);
      try (var rs = stmt.executeQuery(SearchPathCommands.SHOW_SEARCH_PATH)) {
        if (!rs.next()) {
          throw new SQLException("SHOW search_path returned no rows");
        }
        return rs.getString(1);
      }
    }
  }

  private void execute(String sql) throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      applyTimeout(stmt);
      stmt.execute(sql);
    }
  }

  private void applyTimeout(Statement stmt) throws SQLException {
    if (cleanupTimeoutSeconds > 0) {
      stmt.setQueryTimeout(cleanupTimeoutSeconds);
    }
  }

  private void requireState(ConnectionState expected) {
    if (state != expected) {
      throw new IllegalStateException(
          "Connection is " + state + ", expected " + expected);
    }
  }

  private static String normalize(String searchPath) {
    return searchPath == null ? null : searchPath.replace("\"", "").trim();
  }
}
