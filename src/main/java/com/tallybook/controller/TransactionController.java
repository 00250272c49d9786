package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.CreateTransactionRequest;
import com.tallybook.dto.PaginatedTransactions;
import com.tallybook.dto.TransactionFilter;
import com.tallybook.dto.TransactionResponse;
import com.tallybook.dto.TransactionTotals;
import com.tallybook.dto.UpdateTransactionRequest;
import com.tallybook.service.CurrentUserService;
import com.tallybook.service.TransactionService;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transactions")
public class TransactionController {
  private final TransactionService transactionService;
  private final CurrentUserService currentUserService;

  public TransactionController(TransactionService transactionService, CurrentUserService currentUserService) {
    this.transactionService = transactionService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public ActionResult<PaginatedTransactions> listTransactions(
      @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(name = "categoryIds", required = false) List<UUID> categoryIds,
      @RequestParam(name = "page", required = false) Integer page,
      @RequestParam(name = "limit", required = false) Integer limit) {
    UUID userId = currentUserService.requireUserId();
    TransactionFilter filter = new TransactionFilter(startDate, endDate, categoryIds == null ? List.of() : categoryIds);
    return ActionResult.ok(transactionService.list(
        userId,
        filter,
        page == null ? TransactionService.DEFAULT_PAGE : page,
        limit == null ? TransactionService.DEFAULT_LIMIT : limit));
  }

  @GetMapping("/totals")
  public ActionResult<TransactionTotals> totals(
      @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
      @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
      @RequestParam(name = "categoryIds", required = false) List<UUID> categoryIds) {
    UUID userId = currentUserService.requireUserId();
    TransactionFilter filter = new TransactionFilter(startDate, endDate, categoryIds == null ? List.of() : categoryIds);
    return ActionResult.ok(transactionService.totals(userId, filter));
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ActionResult<TransactionResponse> createTransaction(@RequestBody CreateTransactionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(transactionService.create(userId, request));
  }

  @GetMapping("/{transactionId}")
  public ActionResult<TransactionResponse> getTransaction(@PathVariable("transactionId") UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(transactionService.get(userId, transactionId));
  }

  @PatchMapping("/{transactionId}")
  public ActionResult<TransactionResponse> updateTransaction(@PathVariable("transactionId") UUID transactionId,
                                                             @RequestBody UpdateTransactionRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(transactionService.update(userId, transactionId, request));
  }

  @DeleteMapping("/{transactionId}")
  public ActionResult<Void> deleteTransaction(@PathVariable("transactionId") UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    transactionService.delete(userId, transactionId);
    return ActionResult.ok();
  }
}
