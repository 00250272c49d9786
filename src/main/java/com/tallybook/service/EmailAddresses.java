package com.tallybook.service;

import java.util.Locale;
import java.util.regex.Pattern;

final class EmailAddresses {
  private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

  private EmailAddresses() {
  }

  static boolean isValid(String value) {
    return value != null && EMAIL_PATTERN.matcher(value).matches();
  }

  static String normalize(String value) {
    return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
  }
}
