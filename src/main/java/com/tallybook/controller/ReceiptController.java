package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.LinkReceiptRequest;
import com.tallybook.dto.ReceiptResponse;
import com.tallybook.service.CurrentUserService;
import com.tallybook.service.ReceiptService;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
public class ReceiptController {
  private final ReceiptService receiptService;
  private final CurrentUserService currentUserService;

  public ReceiptController(ReceiptService receiptService, CurrentUserService currentUserService) {
    this.receiptService = receiptService;
    this.currentUserService = currentUserService;
  }

  @PostMapping(value = "/receipts", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @ResponseStatus(HttpStatus.CREATED)
  public ActionResult<ReceiptResponse> uploadReceipt(
      @RequestPart(name = "file", required = false) MultipartFile file,
      @RequestParam(name = "transactionId", required = false) UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(receiptService.upload(userId, file, transactionId));
  }

  @GetMapping("/transactions/{transactionId}/receipts")
  public ActionResult<List<ReceiptResponse>> listReceipts(@PathVariable("transactionId") UUID transactionId) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(receiptService.listForTransaction(userId, transactionId));
  }

  @PutMapping("/receipts/{receiptId}/transaction")
  public ActionResult<ReceiptResponse> linkReceipt(@PathVariable("receiptId") UUID receiptId,
                                                   @Valid @RequestBody LinkReceiptRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(receiptService.linkToTransaction(userId, receiptId, request.getTransactionId()));
  }

  @DeleteMapping("/receipts/{receiptId}")
  public ActionResult<Void> deleteReceipt(@PathVariable("receiptId") UUID receiptId) {
    UUID userId = currentUserService.requireUserId();
    receiptService.delete(userId, receiptId);
    return ActionResult.ok();
  }

  @GetMapping("/uploads/{filename:.+}")
  public ResponseEntity<Resource> download(@PathVariable("filename") String filename) {
    UUID userId = currentUserService.requireUserId();
    ReceiptService.StoredFile file = receiptService.loadFile(userId, filename);
    return ResponseEntity.ok()
        .contentType(file.contentType())
        .cacheControl(CacheControl.maxAge(Duration.ofHours(1)).cachePrivate())
        .body(new FileSystemResource(file.path()));
  }
}
