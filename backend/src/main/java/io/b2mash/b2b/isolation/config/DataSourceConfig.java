package io.b2mash.b2b.isolation.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Two Hikari pools on the same database.
 *
 * <ul>
 *   <li>{@code appDataSource}: the shared pool every tenant request multiplexes over. Its {@code
 *       connection-init-sql} puts new connections on the default namespace.
 *   <li>{@code migrationDataSource}: a small pool for DDL (tenant schema create/drop) and the
 *       registry Flyway script. Never handed to tenant work.
 * </ul>
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationJdbcTemplate")
  public JdbcTemplate migrationJdbcTemplate(
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource) {
    return new JdbcTemplate(migrationDataSource);
  }
}
