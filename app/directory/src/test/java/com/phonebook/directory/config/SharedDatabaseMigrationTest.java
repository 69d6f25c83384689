package com.phonebook.directory.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.phonebook.directory.model.AuditAction;
import com.phonebook.directory.repository.AuditLogRepository;
import com.phonebook.directory.service.DirectoryService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SharedDatabaseMigrationTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine").withDatabaseName("directory");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("database.pb.url", POSTGRES::getJdbcUrl);
    registry.add("database.pb.username", POSTGRES::getUsername);
    registry.add("database.pb.password", POSTGRES::getPassword);
    registry.add("database.log.url", POSTGRES::getJdbcUrl);
    registry.add("database.log.username", POSTGRES::getUsername);
    registry.add("database.log.password", POSTGRES::getPassword);
  }

  @Autowired private DirectoryService directoryService;
  @Autowired private AuditLogRepository auditLogRepository;

  @Autowired
  @Qualifier("phonebookJdbcTemplate")
  private NamedParameterJdbcTemplate jdbcTemplate;

  @Test
  void bothStoresMigrateIntoOneDatabase() {
    assertThat(tableExists("phonebook")).isTrue();
    assertThat(tableExists("audit_log")).isTrue();
    assertThat(appliedVersions("flyway_schema_history_phonebook")).contains("1");
    assertThat(appliedVersions("flyway_schema_history_audit_log")).contains("1");
  }

  @Test
  void listWritesAuditEntryInSharedDatabase() {
    directoryService.listContacts();

    assertThat(auditLogRepository.findAll())
        .extracting(entry -> entry.action())
        .contains(AuditAction.LIST);
  }

  private boolean tableExists(String table) {
    final Boolean exists =
        jdbcTemplate.queryForObject(
            """
            SELECT EXISTS (
              SELECT 1 FROM information_schema.tables
              WHERE table_schema = current_schema() AND table_name = :table
            )
            """,
            new MapSqlParameterSource("table", table),
            Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  private List<String> appliedVersions(String historyTable) {
    return jdbcTemplate.queryForList(
        "SELECT version FROM " + historyTable + " WHERE success AND version IS NOT NULL",
        new MapSqlParameterSource(),
        String.class);
  }
}
