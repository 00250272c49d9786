package com.tallybook.model;

public interface LineAmount {
  int getQuantity();

  long getUnitPrice();
}
