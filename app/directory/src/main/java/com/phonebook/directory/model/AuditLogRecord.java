package com.phonebook.directory.model;

import java.time.Instant;

public record AuditLogRecord(
    Long id, Instant timestamp, AuditAction action, String fullName, String phoneNumber) {

  public static AuditLogRecord pending(
      Instant timestamp, AuditAction action, String fullName, String phoneNumber) {
    return new AuditLogRecord(
        null,
        timestamp,
        action,
        fullName == null ? "" : fullName,
        phoneNumber == null ? "" : phoneNumber);
  }
}
