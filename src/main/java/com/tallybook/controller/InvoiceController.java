package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.CreateInvoiceRequest;
import com.tallybook.dto.InvoiceCreatedResponse;
import com.tallybook.dto.InvoiceListItem;
import com.tallybook.dto.InvoiceResponse;
import com.tallybook.dto.InvoiceStatusRequest;
import com.tallybook.dto.UpdateInvoiceRequest;
import com.tallybook.service.CurrentUserService;
import com.tallybook.service.InvoiceService;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {
  private final InvoiceService invoiceService;
  private final CurrentUserService currentUserService;

  public InvoiceController(InvoiceService invoiceService, CurrentUserService currentUserService) {
    this.invoiceService = invoiceService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public ActionResult<List<InvoiceListItem>> listInvoices() {
    return ActionResult.ok(invoiceService.list(currentUserService.requireUserId()));
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ActionResult<InvoiceCreatedResponse> createInvoice(@RequestBody CreateInvoiceRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(invoiceService.create(userId, request));
  }

  @GetMapping("/{invoiceId}")
  public ActionResult<InvoiceResponse> getInvoice(@PathVariable("invoiceId") UUID invoiceId) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(invoiceService.get(userId, invoiceId));
  }

  @PatchMapping("/{invoiceId}")
  public ActionResult<InvoiceResponse> updateInvoice(@PathVariable("invoiceId") UUID invoiceId,
                                                     @RequestBody UpdateInvoiceRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(invoiceService.update(userId, invoiceId, request));
  }

  @PostMapping("/{invoiceId}/status")
  public ActionResult<InvoiceResponse> updateStatus(@PathVariable("invoiceId") UUID invoiceId,
                                                    @RequestBody InvoiceStatusRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(invoiceService.updateStatus(userId, invoiceId, request.getStatus()));
  }

  @PostMapping("/{invoiceId}/void")
  public ActionResult<InvoiceResponse> voidInvoice(@PathVariable("invoiceId") UUID invoiceId) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(invoiceService.voidInvoice(userId, invoiceId));
  }

  @DeleteMapping("/{invoiceId}")
  public ActionResult<Void> deleteInvoice(@PathVariable("invoiceId") UUID invoiceId) {
    UUID userId = currentUserService.requireUserId();
    invoiceService.delete(userId, invoiceId);
    return ActionResult.ok();
  }
}
