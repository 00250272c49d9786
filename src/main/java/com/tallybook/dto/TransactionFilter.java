package com.tallybook.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record TransactionFilter(LocalDate startDate, LocalDate endDate, List<UUID> categoryIds) {
  public static TransactionFilter none() {
    return new TransactionFilter(null, null, List.of());
  }
}
