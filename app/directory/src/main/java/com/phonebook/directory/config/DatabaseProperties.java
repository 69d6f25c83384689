/*
 * Where: Directory configuration binding
 * What: connection settings for the phonebook store (database.pb) and the audit store (database.log)
 * Why: the two stores may live in different databases, so each gets its own connection settings
 */
package com.phonebook.directory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "database")
public record DatabaseProperties(Store pb, Store log) {

  public DatabaseProperties {
    requireUrl("database.pb", pb);
    requireUrl("database.log", log);
  }

  private static void requireUrl(String key, Store store) {
    if (store == null || store.url() == null || store.url().isBlank()) {
      throw new IllegalArgumentException(key + ".url is required");
    }
  }

  public record Store(String url, String username, String password) {}
}
