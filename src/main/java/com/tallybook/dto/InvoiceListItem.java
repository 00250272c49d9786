package com.tallybook.dto;

import com.tallybook.model.InvoiceStatus;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InvoiceListItem {
  private UUID id;
  private String invoiceNumber;
  private String clientName;
  private InvoiceStatus status;
  private LocalDate issueDate;
  private LocalDate dueDate;
  private long total;
}
