package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.DashboardSummary;
import com.tallybook.service.CurrentUserService;
import com.tallybook.service.TransactionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {
  private final TransactionService transactionService;
  private final CurrentUserService currentUserService;

  public DashboardController(TransactionService transactionService, CurrentUserService currentUserService) {
    this.transactionService = transactionService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public ActionResult<DashboardSummary> summary() {
    return ActionResult.ok(transactionService.dashboardSummary(currentUserService.requireUserId()));
  }
}
