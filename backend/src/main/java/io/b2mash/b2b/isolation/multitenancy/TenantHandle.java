package io.b2mash.b2b.isolation.multitenancy;

import java.sql.Connection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Tenant-scoped data access, bound to one connection whose search path points at the tenant's
 * schema. Unqualified table names resolve inside that schema. Only valid inside the {@link
 * TenantWork} it was handed to; any use afterwards throws.
 *
 * <p>Has no registry methods: shared tables are reached through {@link
 * RegistryHandle} or the tenant registry, never through a scoped connection.
 */
public final class TenantHandle {

  private final UUID tenantId;
  private final TenantSchema schema;
  private final JdbcTemplate jdbc;
  private volatile boolean open = true;

  TenantHandle(UUID tenantId, TenantSchema schema, Connection connection, int queryTimeoutSeconds) {
    this.tenantId = tenantId;
    this.schema = schema;
    this.jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    if (queryTimeoutSeconds > 0) {
      this.jdbc.setQueryTimeout(queryTimeoutSeconds);
    }
  }

  public UUID tenantId() {
    return tenantId;
  }

  public String schemaName() {
    return schema.name();
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

  public int update(String sql, Object... args) {
    return jdbc().update(sql, args);
  }

  public void execute(String sql) {
    jdbc().execute(sql);
  }

  boolean isOpen() {
    return open;
  }

  void close() {
    open = false;
  }

  private JdbcTemplate jdbc() {
    if (!open) {
      throw new IllegalStateException(
          "Tenant handle for " + schema + " used outside its connection scope");
    }
    return jdbc;
  }
}
