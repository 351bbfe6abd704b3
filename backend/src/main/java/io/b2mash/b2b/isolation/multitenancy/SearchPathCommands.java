package io.b2mash.b2b.isolation.multitenancy;

import java.util.regex.Pattern;

/**
 * Builds the session commands that move a connection between namespaces. {@link
 * #scopeTo(TenantSchema, String)} is the only place where a tenant identifier is interpolated
 * into a session command.
 */
public final class SearchPathCommands {

  public static final String SHOW_SEARCH_PATH = "SHOW search_path";

  private static final Pattern SCHEMA_PATTERN = Pattern.compile("^tenant_[a-z0-9_-]+$");
  private static final Pattern DEFAULT_SCHEMA_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]*$");

  private SearchPathCommands() {}

  /** {@code SET search_path TO "tenant_x", <default>}, identifier always double-quoted. */
  public static String scopeTo(TenantSchema schema, String defaultSchema) {
    String name = schema.name();
    // Already guaranteed by the sanitizer; re-checked because this string becomes SQL
    if (!SCHEMA_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid schema name: " + name);
    }
    return "SET search_path TO \"" + name + "\", " + validateDefault(defaultSchema);
  }

  public static String resetTo(String defaultSchema) {
    return "SET search_path TO " + validateDefault(defaultSchema);
  }

  private static String validateDefault(String defaultSchema) {
    if (defaultSchema == null || !DEFAULT_SCHEMA_PATTERN.matcher(defaultSchema).matches()) {
      throw new IllegalArgumentException("Invalid default schema: " + defaultSchema);
    }
    return defaultSchema;
  }
}
