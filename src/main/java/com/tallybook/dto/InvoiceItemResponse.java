package com.tallybook.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InvoiceItemResponse {
  private UUID id;
  private String description;
  private int quantity;
  private long unitPrice;
}
