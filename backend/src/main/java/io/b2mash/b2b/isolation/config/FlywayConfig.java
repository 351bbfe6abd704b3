package io.b2mash.b2b.isolation.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bootstraps {@code public.tenants} on the migration pool. Tenant schemas carry no migrations of
 * their own, and {@code clean} stays disabled so the registry can never be wiped by tooling.
 */
@Configuration
public class FlywayConfig {

  static final String REGISTRY_HISTORY_TABLE = "registry_schema_history";

  @Bean(initMethod = "migrate")
  public Flyway registryFlyway(@Qualifier("migrationDataSource") DataSource migrationDataSource) {
    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations("classpath:db/migration/global")
        .schemas("public")
        .createSchemas(false)
        .table(REGISTRY_HISTORY_TABLE)
        .cleanDisabled(true)
        .load();
  }
}
