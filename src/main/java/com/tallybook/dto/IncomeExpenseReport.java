package com.tallybook.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IncomeExpenseReport {
  private long totalIncome;
  private long totalExpenses;
  private long netProfitLoss;
  private List<MonthlyData> monthlyBreakdown;
}
