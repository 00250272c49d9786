package com.tallybook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CategoryType {
  INCOME,
  EXPENSE;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CategoryType fromWire(String value) {
    if (value == null) {
      return null;
    }
    for (CategoryType type : values()) {
      if (type.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return type;
      }
    }
    return null;
  }
}
