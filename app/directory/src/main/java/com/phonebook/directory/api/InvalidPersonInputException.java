package com.phonebook.directory.api;

public class InvalidPersonInputException extends RuntimeException {

  public static final String MESSAGE = "Invalid input. Please check your response and try again.";

  public InvalidPersonInputException() {
    super(MESSAGE);
  }
}
