package com.phonebook.directory.api;

public class PersonNotFoundException extends RuntimeException {

  public static final String MESSAGE = "Person not found in the database";

  public PersonNotFoundException() {
    super(MESSAGE);
  }
}
