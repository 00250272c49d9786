package com.tallybook.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MonthlyData {
  // Display label such as "January 2026".
  private String month;
  private int year;

  // Zero-based month index, 0 = January.
  private int monthNum;
  private long income;
  private long expense;
  private long net;
}
