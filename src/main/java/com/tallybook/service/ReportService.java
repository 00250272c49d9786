package com.tallybook.service;

import com.tallybook.dto.CategoryBreakdownEntry;
import com.tallybook.dto.IncomeExpenseReport;
import com.tallybook.dto.MonthlyData;
import com.tallybook.dto.TransactionTotals;
import com.tallybook.model.Category;
import com.tallybook.model.CategoryType;
import com.tallybook.model.LedgerTransaction;
import com.tallybook.repository.TransactionRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ReportService {
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final TransactionRepository transactionRepository;

  public ReportService(TransactionRepository transactionRepository) {
    this.transactionRepository = transactionRepository;
  }

  @Transactional(readOnly = true)
  public IncomeExpenseReport incomeExpenseReport(UUID userId, LocalDate startDate, LocalDate endDate) {
    requireRange(startDate, endDate);
    List<LedgerTransaction> transactions = transactionRepository.findUserTransactionsInRange(userId, startDate, endDate);
    TransactionTotals totals = MoneyTotals.transactionTotals(transactions);

    Map<YearMonth, List<LedgerTransaction>> byMonth = transactions.stream()
        .collect(Collectors.groupingBy(tx -> YearMonth.from(tx.getDate()), TreeMap::new, Collectors.toList()));
    List<MonthlyData> monthly = new ArrayList<>();
    for (Map.Entry<YearMonth, List<LedgerTransaction>> entry : byMonth.entrySet()) {
      YearMonth month = entry.getKey();
      TransactionTotals bucket = MoneyTotals.transactionTotals(entry.getValue());
      monthly.add(new MonthlyData(
          label(month),
          month.getYear(),
          month.getMonthValue() - 1,
          bucket.income(),
          bucket.expense(),
          bucket.net()));
    }
    return new IncomeExpenseReport(totals.income(), totals.expense(), totals.net(), monthly);
  }

  @Transactional(readOnly = true)
  public List<CategoryBreakdownEntry> categoryBreakdown(UUID userId,
                                                       LocalDate startDate,
                                                       LocalDate endDate,
                                                       CategoryType type) {
    requireRange(startDate, endDate);
    if (type == null) {
      throw BookkeepingException.validation("Type must be 'income' or 'expense'");
    }
    List<LedgerTransaction> transactions =
        transactionRepository.findUserTransactionsInRangeByType(userId, type, startDate, endDate);

    Map<UUID, Long> sums = new LinkedHashMap<>();
    Map<UUID, String> names = new LinkedHashMap<>();
    long grandTotal = 0;
    for (LedgerTransaction tx : transactions) {
      Category category = tx.getCategory();
      sums.merge(category.getId(), tx.getAmount(), Math::addExact);
      names.putIfAbsent(category.getId(), category.getName());
      grandTotal = Math.addExact(grandTotal, tx.getAmount());
    }

    List<CategoryBreakdownEntry> entries = new ArrayList<>();
    for (Map.Entry<UUID, Long> entry : sums.entrySet()) {
      entries.add(new CategoryBreakdownEntry(
          entry.getKey(),
          names.get(entry.getKey()),
          entry.getValue(),
          percentage(entry.getValue(), grandTotal)));
    }
    entries.sort(Comparator.comparingLong(CategoryBreakdownEntry::getAmount).reversed()
        .thenComparing(CategoryBreakdownEntry::getCategoryName));
    return entries;
  }

  static BigDecimal percentage(long amount, long grandTotal) {
    if (grandTotal == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return BigDecimal.valueOf(amount)
        .multiply(HUNDRED)
        .divide(BigDecimal.valueOf(grandTotal), 2, RoundingMode.HALF_UP);
  }

  private static String label(YearMonth month) {
    return month.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + month.getYear();
  }

  private void requireRange(LocalDate startDate, LocalDate endDate) {
    if (startDate == null || endDate == null) {
      throw BookkeepingException.validation("Start date and end date are required");
    }
    if (startDate.isAfter(endDate)) {
      throw BookkeepingException.validation("Start date must not be after end date");
    }
  }
}
