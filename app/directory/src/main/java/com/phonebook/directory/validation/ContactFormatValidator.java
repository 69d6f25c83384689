package com.phonebook.directory.validation;

import java.util.regex.Pattern;

public final class ContactFormatValidator {

  static final int FULL_NAME_MAX_LENGTH = 35;

  // Alternatives, in order: up to three plain words; "Last, First ..."; "First O'Last[-Other]";
  // "O'Last, First I."; "First I. Last"; "First I. O'Last"; "Last, First I."
  private static final Pattern FULL_NAME =
      Pattern.compile(
          "(?=[^\\n]{1," + FULL_NAME_MAX_LENGTH + "}\\z)("
              + "([A-Za-z]+\\s?){1,3}"
              + "|[A-Za-z]+,\\s[A-Za-z]+[\\sA-Za-z]*"
              + "|([A-Za-z]+\\s)[A-Za-z]'[A-Za-z]+(-[A-Za-z]+)?"
              + "|[A-Za-z]'[A-Za-z]+,\\s[A-Za-z]+\\s[A-Z]\\."
              + "|[A-Za-z]+\\s[A-Za-z]\\.\\s[A-Za-z]+"
              + "|[A-Za-z]+\\s[A-Za-z]\\.\\s[A-Z]'[A-Za-z]+"
              + "|[A-Za-z]+,\\s[A-Za-z]+\\s[A-Z]\\."
              + ")");

  // A run of six or more leading digits is an unformatted number and never accepted.
  private static final Pattern PHONE_NUMBER =
      Pattern.compile(
          "(?!\\d{6,})"
              + "\\+?\\d{0,3}\\s?"
              + "(\\d\\s|\\(\\d{2}\\)\\s|\\(\\d{3}\\))?"
              + "[.-]?\\d{2,5}[\\s.-]?\\d{2,5}[\\s.-]?\\d{1,9}");

  private ContactFormatValidator() {}

  public static boolean validateFullName(String fullName) {
    return fullName != null && FULL_NAME.matcher(fullName).matches();
  }

  public static boolean validatePhoneNumber(String phoneNumber) {
    return phoneNumber != null && PHONE_NUMBER.matcher(phoneNumber).matches();
  }
}
