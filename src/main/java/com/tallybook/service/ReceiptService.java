package com.tallybook.service;

import com.tallybook.config.StorageProperties;
import com.tallybook.dto.ReceiptResponse;
import com.tallybook.model.LedgerTransaction;
import com.tallybook.model.Receipt;
import com.tallybook.model.User;
import com.tallybook.repository.ReceiptRepository;
import com.tallybook.repository.TransactionRepository;
import com.tallybook.repository.UserRepository;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

@Service
public class ReceiptService {
  private static final Logger log = LoggerFactory.getLogger(ReceiptService.class);

  private final ReceiptRepository receiptRepository;
  private final TransactionRepository transactionRepository;
  private final UserRepository userRepository;
  private final ReceiptStorage storage;
  private final StorageProperties properties;

  public ReceiptService(ReceiptRepository receiptRepository,
                        TransactionRepository transactionRepository,
                        UserRepository userRepository,
                        ReceiptStorage storage,
                        StorageProperties properties) {
    this.receiptRepository = receiptRepository;
    this.transactionRepository = transactionRepository;
    this.userRepository = userRepository;
    this.storage = storage;
    this.properties = properties;
  }

  public void validateUpload(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw BookkeepingException.validation("No file provided");
    }
    if (file.getContentType() == null || !properties.allowedContentTypes().contains(file.getContentType())) {
      throw BookkeepingException.validation("Invalid file type. Only JPG, PNG, and PDF files are allowed.");
    }
    if (file.getSize() > properties.maxFileSize().toBytes()) {
      throw BookkeepingException.validation(tooLargeMessage(properties));
    }
    FieldLimits.requireMaxLength(file.getOriginalFilename(), Receipt.FILE_NAME_LENGTH, "File name");
  }

  @Transactional
  public ReceiptResponse upload(UUID userId, MultipartFile file, UUID transactionId) {
    validateUpload(file);
    LedgerTransaction transaction = transactionId == null ? null : requireTransaction(userId, transactionId);
    User user = userRepository.findById(userId)
        .orElseThrow(() -> BookkeepingException.notFound("User not found"));

    String reference = storage.store(file);
    Receipt receipt = new Receipt();
    receipt.setUser(user);
    receipt.setTransaction(transaction);
    receipt.setFilePath(reference);
    receipt.setFileName(originalName(file));
    try {
      Receipt saved = receiptRepository.saveAndFlush(receipt);
      log.info("Stored receipt {} for user {} at {}", saved.getId(), userId, reference);
      return toResponse(saved);
    } catch (RuntimeException ex) {
      storage.delete(reference);
      throw ex;
    }
  }

  @Transactional(readOnly = true)
  public List<ReceiptResponse> listForTransaction(UUID userId, UUID transactionId) {
    requireTransaction(userId, transactionId);
    return receiptRepository.findByTransactionIdAndUserIdOrderByUploadedAtDesc(transactionId, userId).stream()
        .map(this::toResponse)
        .toList();
  }

  @Transactional
  public ReceiptResponse linkToTransaction(UUID userId, UUID receiptId, UUID transactionId) {
    Receipt receipt = requireReceipt(userId, receiptId);
    LedgerTransaction transaction = requireTransaction(userId, transactionId);
    receipt.setTransaction(transaction);
    receiptRepository.save(receipt);
    return toResponse(receipt);
  }

  @Transactional
  public void delete(UUID userId, UUID receiptId) {
    Receipt receipt = requireReceipt(userId, receiptId);
    receiptRepository.delete(receipt);
    receiptRepository.flush();
    storage.delete(receipt.getFilePath());
    log.info("Deleted receipt {} for user {}", receiptId, userId);
  }

  @Transactional(readOnly = true)
  public StoredFile loadFile(UUID userId, String fileName) {
    receiptRepository.findFirstByUserIdAndFilePath(userId, ReceiptStorage.referenceFor(fileName))
        .orElseThrow(() -> BookkeepingException.notFound("File not found"));
    Path path = storage.resolveExisting(fileName)
        .orElseThrow(() -> BookkeepingException.notFound("File not found"));
    return new StoredFile(path, ReceiptStorage.contentTypeFor(fileName));
  }

  private LedgerTransaction requireTransaction(UUID userId, UUID transactionId) {
    return transactionRepository.findByIdAndUserId(transactionId, userId)
        .orElseThrow(() -> BookkeepingException.notFound("Transaction not found"));
  }

  private Receipt requireReceipt(UUID userId, UUID receiptId) {
    return receiptRepository.findByIdAndUserId(receiptId, userId)
        .orElseThrow(() -> BookkeepingException.notFound("Receipt not found"));
  }

  public static String tooLargeMessage(StorageProperties properties) {
    return "File too large. Maximum size is " + properties.maxFileSize().toMegabytes() + "MB.";
  }

  private static String originalName(MultipartFile file) {
    String name = file.getOriginalFilename();
    return name == null || name.isBlank() ? "receipt" : name;
  }

  private ReceiptResponse toResponse(Receipt receipt) {
    return new ReceiptResponse(
        receipt.getId(),
        receipt.getFileName(),
        receipt.getFilePath(),
        receipt.getUploadedAt(),
        receipt.getTransaction() == null ? null : receipt.getTransaction().getId()
    );
  }

  public record StoredFile(Path path, MediaType contentType) {}
}
