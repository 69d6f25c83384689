/*
 * Where: Directory configuration
 * What: builds one pooled DataSource, JDBC template and Flyway migration per store
 * Why: Spring Boot auto-configures a single DataSource, the directory needs two
 */
package com.phonebook.directory.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
public class DirectoryStoreConfig {

  static final String PHONEBOOK_MIGRATIONS = "classpath:db/phonebook";
  static final String AUDIT_LOG_MIGRATIONS = "classpath:db/auditlog";
  static final String BASELINE_VERSION = "0";

  @Bean
  public HikariDataSource phonebookDataSource(DatabaseProperties properties) {
    return buildDataSource("phonebook-pool", properties.pb());
  }

  @Bean
  public HikariDataSource auditLogDataSource(DatabaseProperties properties) {
    return buildDataSource("audit-log-pool", properties.log());
  }

  @Bean
  public NamedParameterJdbcTemplate phonebookJdbcTemplate(
      @Qualifier("phonebookDataSource") DataSource dataSource) {
    return new NamedParameterJdbcTemplate(dataSource);
  }

  @Bean
  public NamedParameterJdbcTemplate auditLogJdbcTemplate(
      @Qualifier("auditLogDataSource") DataSource dataSource) {
    return new NamedParameterJdbcTemplate(dataSource);
  }

  // Each store keeps its own history table so both can share one database if configured so.
  // Baselining below V1 keeps every migration applicable when the other store's tables already
  // occupy the schema.
  @Bean(initMethod = "migrate")
  public Flyway phonebookFlyway(@Qualifier("phonebookDataSource") DataSource dataSource) {
    return buildFlyway(dataSource, PHONEBOOK_MIGRATIONS, "flyway_schema_history_phonebook");
  }

  @Bean(initMethod = "migrate")
  public Flyway auditLogFlyway(@Qualifier("auditLogDataSource") DataSource dataSource) {
    return buildFlyway(dataSource, AUDIT_LOG_MIGRATIONS, "flyway_schema_history_audit_log");
  }

  private HikariDataSource buildDataSource(String poolName, DatabaseProperties.Store store) {
    final HikariDataSource dataSource =
        DataSourceBuilder.create()
            .type(HikariDataSource.class)
            .url(store.url())
            .username(store.username())
            .password(store.password())
            .build();
    dataSource.setPoolName(poolName);
    return dataSource;
  }

  private Flyway buildFlyway(DataSource dataSource, String location, String historyTable) {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations(location)
        .table(historyTable)
        .baselineOnMigrate(true)
        .baselineVersion(BASELINE_VERSION)
        .load();
  }
}
