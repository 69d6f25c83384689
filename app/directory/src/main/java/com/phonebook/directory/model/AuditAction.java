package com.phonebook.directory.model;

import java.util.Arrays;

public enum AuditAction {
  LIST("list"),
  ADD("add"),
  DELETE_BY_NAME("delete-by-name"),
  DELETE_BY_NUMBER("delete-by-number");

  private final String tag;

  AuditAction(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  public static AuditAction fromTag(String tag) {
    return Arrays.stream(values())
        .filter(action -> action.tag.equals(tag))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown audit action: " + tag));
  }
}
