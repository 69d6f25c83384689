package com.phonebook.directory.api.response;

public record MessageResponse(String message) {

  public static final String PERSON_ADDED = "Person added successfully";
  public static final String PERSON_DELETED = "Person deleted successfully";
}
