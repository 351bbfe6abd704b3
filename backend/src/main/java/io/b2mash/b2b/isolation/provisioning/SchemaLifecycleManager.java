package io.b2mash.b2b.isolation.provisioning;

import io.b2mash.b2b.isolation.audit.AuditEventBuilder;
import io.b2mash.b2b.isolation.audit.AuditService;
import io.b2mash.b2b.isolation.exception.ResourceAlreadyExistsException;
import io.b2mash.b2b.isolation.exception.ResourceNotEmptyException;
import io.b2mash.b2b.isolation.exception.ResourceNotFoundException;
import io.b2mash.b2b.isolation.multitenancy.TenantNamespaces;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Creates, inspects and drops tenant schemas through the migration pool. Each operation runs
 * inside a single {@link ConnectionCallback}, so exactly one connection is acquired and released
 * per call on every path.
 */
@Service
public class SchemaLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(SchemaLifecycleManager.class);

  /** PostgreSQL {@code duplicate_schema}. */
  static final String DUPLICATE_SCHEMA = "42P06";

  private static final Pattern SCHEMA_PATTERN = Pattern.compile("^tenant_[a-z0-9_-]+$");

  private static final String SCHEMA_EXISTS_SQL =
      "SELECT 1 FROM information_schema.schemata WHERE schema_name = ?";
  private static final String TABLE_COUNT_SQL =
      "SELECT count(*) FROM information_schema.tables WHERE table_schema = ?";
  private static final String LIST_SCHEMAS_SQL =
      "SELECT schema_name FROM information_schema.schemata"
          + " WHERE schema_name LIKE 'tenant\\_%' ORDER BY schema_name";

  private final JdbcTemplate jdbcTemplate;
  private final AuditService auditService;

  public SchemaLifecycleManager(
      @Qualifier("migrationJdbcTemplate") JdbcTemplate jdbcTemplate, AuditService auditService) {
    this.jdbcTemplate = jdbcTemplate;
    this.auditService = auditService;
  }

  /**
   * Creates {@code tenant_<token>} for {@code subdomain} and grants the current role full access.
   * If the grant fails the schema stays; {@link #configure(String)} completes it.
   *
   * @throws ResourceAlreadyExistsException if the schema exists, including when a concurrent
   *     create wins the race between the catalog check and the DDL
   */
  public SchemaCreationResult create(String subdomain) {
    String schemaName = TenantNamespaces.schemaName(subdomain);
    long start = System.nanoTime();

    jdbcTemplate.execute(
        (ConnectionCallback<Void>)
            conn -> {
              if (schemaExists(conn, schemaName)) {
                throw new ResourceAlreadyExistsException("Schema", schemaName);
              }
              try (var stmt = conn.createStatement()) {
                stmt.execute("CREATE SCHEMA " + quoted(schemaName));
              } catch (SQLException e) {
                if (DUPLICATE_SCHEMA.equals(e.getSQLState())) {
                  throw new ResourceAlreadyExistsException("Schema", schemaName, e);
                }
                throw e;
              }
              grantAccess(conn, schemaName);
              return null;
            });

    long durationMs = (System.nanoTime() - start) / 1_000_000;
    var createdAt = Instant.now();
    log.info("Created schema {} in {} ms", schemaName, durationMs);
    auditService.log(
        AuditEventBuilder.builder()
            .action("schema.created")
            .entityType("schema")
            .entityId(schemaName)
            .details(Map.of("subdomain", subdomain, "durationMs", durationMs))
            .build());
    return new SchemaCreationResult(schemaName, createdAt, durationMs);
  }

  /**
   * Re-applies the grants of {@link #create(String)} to an existing schema. Safe to repeat.
   *
   * @throws ResourceNotFoundException if the schema does not exist
   */
  public void configure(String subdomain) {
    String schemaName = TenantNamespaces.schemaName(subdomain);
    jdbcTemplate.execute(
        (ConnectionCallback<Void>)
            conn -> {
              if (!schemaExists(conn, schemaName)) {
                throw new ResourceNotFoundException("Schema", schemaName);
              }
              grantAccess(conn, schemaName);
              return null;
            });
    log.info("Configured schema {}", schemaName);
  }

  public SchemaVerification verify(String subdomain) {
    String schemaName = TenantNamespaces.schemaName(subdomain);
    return jdbcTemplate.execute(
        (ConnectionCallback<SchemaVerification>)
            conn -> {
              if (!schemaExists(conn, schemaName)) {
                return new SchemaVerification(schemaName, false, 0);
              }
              return new SchemaVerification(schemaName, true, countTables(conn, schemaName));
            });
  }

  /**
   * Drops the tenant schema with everything in it.
   *
   * @param requireEmpty refuse to drop a schema that still has tables
   * @return false if there was no schema to drop
   * @throws ResourceNotEmptyException if {@code requireEmpty} and the schema has tables
   */
  public boolean drop(String subdomain, boolean requireEmpty) {
    String schemaName = TenantNamespaces.schemaName(subdomain);

    Integer droppedTables =
        jdbcTemplate.execute(
            (ConnectionCallback<Integer>)
                conn -> {
                  if (!schemaExists(conn, schemaName)) {
                    return null;
                  }
                  int tableCount = countTables(conn, schemaName);
                  if (requireEmpty && tableCount > 0) {
                    throw new ResourceNotEmptyException(
                        "Schema",
                        schemaName,
                        "Schema contains " + tableCount + " tables; drop them first");
                  }
                  try (var stmt = conn.createStatement()) {
                    stmt.execute("DROP SCHEMA IF EXISTS " + quoted(schemaName) + " CASCADE");
                  }
                  return tableCount;
                });

    if (droppedTables == null) {
      log.info("Schema {} does not exist, nothing to drop", schemaName);
      return false;
    }
    log.info("Dropped schema {} ({} tables)", schemaName, droppedTables);
    auditService.log(
        AuditEventBuilder.builder()
            .action("schema.dropped")
            .entityType("schema")
            .entityId(schemaName)
            .details(Map.of("subdomain", subdomain, "tableCount", droppedTables))
            .build());
    return true;
  }

  /** Every {@code tenant_*} schema in the database, sorted by name. */
  public List<String> list() {
    return jdbcTemplate.execute(
        (ConnectionCallback<List<String>>)
            conn -> {
              var names = new ArrayList<String>();
              try (var stmt = conn.prepareStatement(LIST_SCHEMAS_SQL);
                  var rs = stmt.executeQuery()) {
                while (rs.next()) {
                  names.add(rs.getString(1));
                }
              }
              return names;
            });
  }

  private static boolean schemaExists(Connection conn, String schemaName) throws SQLException {
    try (var stmt = conn.prepareStatement(SCHEMA_EXISTS_SQL)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static void grantAccess(Connection conn, String schemaName) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute("GRANT ALL ON SCHEMA " + quoted(schemaName) + " TO CURRENT_USER");
    }
  }

  private static int countTables(Connection conn, String schemaName) throws SQLException {
    try (var stmt = conn.prepareStatement(TABLE_COUNT_SQL)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        return rs.next() ? rs.getInt(1) : 0;
      }
    }
  }

  private static String quoted(String schemaName) {
    // Names come from TenantNamespaces; re-checked because they are concatenated into DDL
    if (!SCHEMA_PATTERN.matcher(schemaName).matches()) {
      throw new IllegalArgumentException("Invalid schema name: " + schemaName);
    }
    return "\"" + schemaName + "\"";
  }
}
