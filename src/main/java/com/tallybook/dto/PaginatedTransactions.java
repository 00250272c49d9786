package com.tallybook.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PaginatedTransactions {
  private List<TransactionResponse> transactions;
  private long total;
  private int page;
  private int totalPages;
}
