package com.phonebook.directory.api;

public enum ApiErrorCode {
  INVALID_INPUT,
  PHONE_NUMBER_CONFLICT,
  PERSON_CONFLICT,
  PERSON_NOT_FOUND,
  INTERNAL_ERROR
}
