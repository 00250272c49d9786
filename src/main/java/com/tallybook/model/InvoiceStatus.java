package com.tallybook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum InvoiceStatus {
  DRAFT,
  SENT,
  PAID,
  CANCELLED;

  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static InvoiceStatus fromWire(String value) {
    if (value == null) {
      return null;
    }
    for (InvoiceStatus status : values()) {
      if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return status;
      }
    }
    return null;
  }
}
