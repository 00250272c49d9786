package com.tallybook.dto;

import java.time.LocalDate;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateInvoiceRequest {
  private String clientName;
  private String clientEmail;
  private LocalDate issueDate;
  private LocalDate dueDate;
  private String notes;
  private List<InvoiceItemRequest> items;
}
