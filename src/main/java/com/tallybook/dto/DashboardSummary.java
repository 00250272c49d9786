package com.tallybook.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DashboardSummary {
  private long currentMonthIncome;
  private long currentMonthExpenses;
  private long netBalance;
  private List<TransactionResponse> recentTransactions;
}
