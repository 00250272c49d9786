package com.tallybook.dto;

public record TransactionTotals(long income, long expense, long net) {
  public static final TransactionTotals ZERO = new TransactionTotals(0, 0, 0);
}
