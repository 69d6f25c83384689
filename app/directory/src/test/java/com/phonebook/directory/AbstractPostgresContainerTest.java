package com.phonebook.directory;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

  // Shared by every test class in the JVM so the cached Spring context keeps valid URLs.
  static final PostgreSQLContainer<?> PHONEBOOK_DB =
      new PostgreSQLContainer<>("postgres:16-alpine").withDatabaseName("phonebook");
  static final PostgreSQLContainer<?> AUDIT_LOG_DB =
      new PostgreSQLContainer<>("postgres:16-alpine").withDatabaseName("auditlog");

  static {
    // Subclasses carry @Testcontainers(disabledWithoutDocker = true); without Docker nothing starts.
    if (DockerClientFactory.instance().isDockerAvailable()) {
      PHONEBOOK_DB.start();
      AUDIT_LOG_DB.start();
    }
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("database.pb.url", PHONEBOOK_DB::getJdbcUrl);
    registry.add("database.pb.username", PHONEBOOK_DB::getUsername);
    registry.add("database.pb.password", PHONEBOOK_DB::getPassword);
    registry.add("database.log.url", AUDIT_LOG_DB::getJdbcUrl);
    registry.add("database.log.username", AUDIT_LOG_DB::getUsername);
    registry.add("database.log.password", AUDIT_LOG_DB::getPassword);
  }
}
