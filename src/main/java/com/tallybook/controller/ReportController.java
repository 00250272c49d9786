package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.CategoryBreakdownEntry;
import com.tallybook.dto.IncomeExpenseReport;
import com.tallybook.service.CurrentUserService;
import com.tallybook.service.ReportService;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
public class ReportController {
  private final ReportService reportService;
  private final CurrentUserService currentUserService;

  public ReportController(ReportService reportService, CurrentUserService currentUserService) {
    this.reportService = reportService;
    this.currentUserService = currentUserService;
  }

  @GetMapping("/income-expense")
  public ActionResult<IncomeExpenseReport> incomeExpense(
      @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(reportService.incomeExpenseReport(userId, startDate, endDate));
  }

  @GetMapping("/category-breakdown")
  public ActionResult<List<CategoryBreakdownEntry>> categoryBreakdown(
      @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(name = "type", defaultValue = "expense") String type) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(reportService.categoryBreakdown(userId, startDate, endDate, CategoryController.parseType(type)));
  }
}
