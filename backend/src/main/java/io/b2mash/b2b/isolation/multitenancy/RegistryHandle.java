package io.b2mash.b2b.isolation.multitenancy;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Read-only access on a connection verified to be on the default namespace. Used for shared,
 * non-tenant tables such as {@code public.tenants}.
 */
public final class RegistryHandle {

  private final JdbcTemplate jdbc;
  private volatile boolean open = true;

  RegistryHandle(Connection connection, int queryTimeoutSeconds) {
    this.jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    if (queryTimeoutSeconds > 0) {
      this.jdbc.setQueryTimeout(queryTimeoutSeconds);
    }
  }

  public <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... args) {
    return jdbc().query(sql, rowMapper, args);
  }

  public <T> T queryForObject(String sql, Class<T> requiredType, Object... args) {
    return jdbc().queryForObject(sql, requiredType, args);
  }

  public List<Map<String, Object>> queryForList(String sql, Object... args) {
    return jdbc().queryForList(sql, args);
  }

  /** The connection's current search path, as reported by the server. */
  public String searchPath() {
    return jdbc().queryForObject(SearchPathCommands.SHOW_SEARCH_PATH, String.class);
  }

  void close() {
    open = false;
  }

  private JdbcTemplate jdbc() {
    if (!open) {
      throw new IllegalStateException("Registry handle used outside its connection scope");
    }
    return jdbc;
  }
}
