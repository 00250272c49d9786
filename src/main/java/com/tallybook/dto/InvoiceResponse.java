package com.tallybook.dto;

import com.tallybook.model.InvoiceStatus;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class InvoiceResponse {
  private UUID id;
  private String invoiceNumber;
  private String clientName;
  private String clientEmail;
  private InvoiceStatus status;
  private LocalDate issueDate;
  private LocalDate dueDate;
  private String notes;
  private Instant createdAt;
  private Instant updatedAt;
  private List<InvoiceItemResponse> items;
  private long total;
}
