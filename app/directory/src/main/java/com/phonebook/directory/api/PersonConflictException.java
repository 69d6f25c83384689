package com.phonebook.directory.api;

public class PersonConflictException extends RuntimeException {

  public enum ConflictKind {
    PHONE_NUMBER("Phone number already exists in the database"),
    FULL_NAME("Person already exists in the database");

    private final String message;

    ConflictKind(String message) {
      this.message = message;
    }
  }

  private final ConflictKind kind;

  public PersonConflictException(ConflictKind kind) {
    super(kind.message);
    this.kind = kind;
  }

  public ConflictKind kind() {
    return kind;
  }
}
