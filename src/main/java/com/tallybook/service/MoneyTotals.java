package com.tallybook.service;

import com.tallybook.dto.TransactionTotals;
import com.tallybook.model.LedgerTransaction;
import com.tallybook.model.LineAmount;
import java.util.Collection;

/**
 * The derived sums shown across the app. Totals are never stored; every view recomputes them
 * here from the current rows, in minor currency units.
 */
public final class MoneyTotals {
  private MoneyTotals() {
  }

  public static long invoiceTotal(Collection<? extends LineAmount> items) {
    long total = 0;
    if (items == null) {
      return total;
    }
    for (LineAmount item : items) {
      total = Math.addExact(total, Math.multiplyExact((long) item.getQuantity(), item.getUnitPrice()));
    }
    return total;
  }

  public static TransactionTotals transactionTotals(Collection<LedgerTransaction> transactions) {
    long income = 0;
    long expense = 0;
    if (transactions == null) {
      return TransactionTotals.ZERO;
    }
    for (LedgerTransaction tx : transactions) {
      switch (tx.getType()) {
        case INCOME -> income = Math.addExact(income, tx.getAmount());
        case EXPENSE -> expense = Math.addExact(expense, tx.getAmount());
      }
    }
    return new TransactionTotals(income, expense, income - expense);
  }
}
