package com.tallybook.dto;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CategoryBreakdownEntry {
  private UUID categoryId;
  private String categoryName;
  private long amount;
  private BigDecimal percentage;
}
