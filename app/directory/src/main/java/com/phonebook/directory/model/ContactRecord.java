package com.phonebook.directory.model;

public record ContactRecord(long id, String fullName, String phoneNumber) {}
