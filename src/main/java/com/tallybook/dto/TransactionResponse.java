package com.tallybook.dto;

import com.tallybook.model.CategoryType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionResponse {
  private UUID id;
  private CategoryType type;
  private long amount;
  private String description;
  private UUID categoryId;
  private LocalDate date;
  private Instant createdAt;
  private Instant updatedAt;
  private CategorySummary category;
}
