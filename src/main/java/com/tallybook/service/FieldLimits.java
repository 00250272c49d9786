package com.tallybook.service;

final class FieldLimits {
  private FieldLimits() {
  }

  static void requireMaxLength(String value, int maxLength, String label) {
    if (value != null && value.length() > maxLength) {
      throw BookkeepingException.validation(label + " must be at most " + maxLength + " characters");
    }
  }
}
