package com.tallybook.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class InvoiceItemRequest {
  private String description;
  private Integer quantity;

  // Minor currency units.
  private Long unitPrice;
}
