package com.tallybook.dto;

import com.tallybook.model.CategoryType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateTransactionRequest {
  private CategoryType type;
  private BigDecimal amount;
  private String description;
  private UUID categoryId;
  private LocalDate date;
}
