package com.phonebook.directory.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonebook.directory.model.ContactRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ContactResponse(long id, String fullName, String phoneNumber) {

  public static ContactResponse from(ContactRecord record) {
    return new ContactResponse(record.id(), record.fullName(), record.phoneNumber());
  }
}
