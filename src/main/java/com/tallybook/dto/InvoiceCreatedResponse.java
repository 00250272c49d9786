package com.tallybook.dto;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InvoiceCreatedResponse {
  private UUID id;
  private String invoiceNumber;
}
