package com.tallybook.service;

import com.tallybook.dto.CreateInvoiceRequest;
import com.tallybook.dto.InvoiceCreatedResponse;
import com.tallybook.dto.InvoiceItemRequest;
import com.tallybook.dto.InvoiceItemResponse;
import com.tallybook.dto.InvoiceListItem;
import com.tallybook.dto.InvoiceResponse;
import com.tallybook.dto.UpdateInvoiceRequest;
import com.tallybook.model.Invoice;
import com.tallybook.model.InvoiceItem;
import com.tallybook.model.InvoiceStatus;
import com.tallybook.model.LineAmount;
import com.tallybook.model.User;
import com.tallybook.repository.InvoiceRepository;
import com.tallybook.repository.UserRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InvoiceService {
  private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);
  private static final String NUMBER_PREFIX = "INV-";

  private final InvoiceRepository invoiceRepository;
  private final UserRepository userRepository;
  private final InvoiceStateMachine stateMachine;

  public InvoiceService(InvoiceRepository invoiceRepository,
                        UserRepository userRepository,
                        InvoiceStateMachine stateMachine) {
    this.invoiceRepository = invoiceRepository;
    this.userRepository = userRepository;
    this.stateMachine = stateMachine;
  }

  @Transactional
  public InvoiceCreatedResponse create(UUID userId, CreateInvoiceRequest request) {
    String clientName = trimToNull(request.getClientName());
    if (clientName == null) {
      throw BookkeepingException.validation("Client name is required");
    }
    FieldLimits.requireMaxLength(clientName, Invoice.CLIENT_NAME_LENGTH, "Client name");
    if (request.getIssueDate() == null) {
      throw BookkeepingException.validation("Issue date is required");
    }
    if (request.getDueDate() == null) {
      throw BookkeepingException.validation("Due date is required");
    }
    requireDateOrder(request.getIssueDate(), request.getDueDate());
    String clientEmail = validClientEmail(request.getClientEmail());
    validateItems(request.getItems());
    User user = userRepository.findById(userId)
        .orElseThrow(() -> BookkeepingException.notFound("User not found"));

    Invoice invoice = new Invoice();
    invoice.setUser(user);
    invoice.setInvoiceNumber(nextInvoiceNumber(userId));
    invoice.setClientName(clientName);
    invoice.setClientEmail(clientEmail);
    invoice.setStatus(InvoiceStatus.DRAFT);
    invoice.setIssueDate(request.getIssueDate());
    invoice.setDueDate(request.getDueDate());
    invoice.setNotes(trimToNull(request.getNotes()));
    for (InvoiceItemRequest item : request.getItems()) {
      invoice.addItem(toItem(item));
    }
    Invoice saved = invoiceRepository.save(invoice);
    log.info("Created invoice {} ({}) for user {}", saved.getInvoiceNumber(), saved.getId(), userId);
    return new InvoiceCreatedResponse(saved.getId(), saved.getInvoiceNumber());
  }

  @Transactional(readOnly = true)
  public InvoiceResponse get(UUID userId, UUID invoiceId) {
    return toResponse(requireInvoice(userId, invoiceId));
  }

  @Transactional(readOnly = true)
  public List<InvoiceListItem> list(UUID userId) {
    Map<UUID, List<LineAmount>> amountsByInvoice = new HashMap<>();
    for (Object[] row : invoiceRepository.findLineAmountsForUser(userId)) {
      UUID invoiceId = (UUID) row[0];
      LineAmount amount = new ItemAmount(((Number) row[1]).intValue(), ((Number) row[2]).longValue());
      amountsByInvoice.computeIfAbsent(invoiceId, key -> new ArrayList<>()).add(amount);
    }
    return invoiceRepository.findByUserIdOrderByIssueDateDesc(userId).stream()
        .map(invoice -> new InvoiceListItem(
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getClientName(),
            invoice.getStatus(),
            invoice.getIssueDate(),
            invoice.getDueDate(),
            MoneyTotals.invoiceTotal(amountsByInvoice.getOrDefault(invoice.getId(), List.of()))))
        .toList();
  }

  @Transactional
  public InvoiceResponse update(UUID userId, UUID invoiceId, UpdateInvoiceRequest request) {
    Invoice invoice = requireInvoice(userId, invoiceId);
    if (!stateMachine.isEditable(invoice.getStatus())) {
      throw new BookkeepingException(ErrorKind.IMMUTABLE, "Only draft invoices can be edited");
    }
    String clientName = null;
    if (request.getClientName() != null) {
      clientName = trimToNull(request.getClientName());
      if (clientName == null) {
        throw BookkeepingException.validation("Client name is required");
      }
      FieldLimits.requireMaxLength(clientName, Invoice.CLIENT_NAME_LENGTH, "Client name");
    }
    String clientEmail = request.getClientEmail() == null ? null : validClientEmail(request.getClientEmail());
    if (request.getItems() != null) {
      validateItems(request.getItems());
    }
    LocalDate issueDate = request.getIssueDate() == null ? invoice.getIssueDate() : request.getIssueDate();
    LocalDate dueDate = request.getDueDate() == null ? invoice.getDueDate() : request.getDueDate();
    requireDateOrder(issueDate, dueDate);

    if (clientName != null) {
      invoice.setClientName(clientName);
    }
    if (request.getClientEmail() != null) {
      invoice.setClientEmail(clientEmail);
    }
    invoice.setIssueDate(issueDate);
    invoice.setDueDate(dueDate);
    if (request.getNotes() != null) {
      invoice.setNotes(trimToNull(request.getNotes()));
    }
    if (request.getItems() != null) {
      invoice.getItems().clear();
      for (InvoiceItemRequest item : request.getItems()) {
        invoice.addItem(toItem(item));
      }
    }
    invoice.touch();
    invoiceRepository.flush();
    return toResponse(invoice);
  }

  @Transactional
  public InvoiceResponse updateStatus(UUID userId, UUID invoiceId, InvoiceStatus newStatus) {
    if (newStatus == null) {
      throw BookkeepingException.validation("Status must be one of draft, sent, paid or cancelled");
    }
    Invoice invoice = requireInvoice(userId, invoiceId);
    stateMachine.transition(invoice, newStatus);
    invoiceRepository.save(invoice);
    return toResponse(invoice);
  }

  @Transactional
  public InvoiceResponse voidInvoice(UUID userId, UUID invoiceId) {
    Invoice invoice = requireInvoice(userId, invoiceId);
    stateMachine.voidInvoice(invoice);
    invoiceRepository.save(invoice);
    return toResponse(invoice);
  }

  @Transactional
  public void delete(UUID userId, UUID invoiceId) {
    Invoice invoice = requireInvoice(userId, invoiceId);
    if (!stateMachine.isEditable(invoice.getStatus())) {
      throw new BookkeepingException(ErrorKind.IMMUTABLE, "Only draft invoices can be deleted");
    }
    invoiceRepository.delete(invoice);
    log.info("Deleted draft invoice {} ({})", invoice.getInvoiceNumber(), invoice.getId());
  }

  String nextInvoiceNumber(UUID userId) {
    long next = invoiceRepository.countByUserId(userId) + 1;
    String candidate = formatNumber(next);
    while (invoiceRepository.existsByUserIdAndInvoiceNumber(userId, candidate)) {
      next++;
      candidate = formatNumber(next);
    }
    return candidate;
  }

  static String formatNumber(long number) {
    return NUMBER_PREFIX + String.format("%03d", number);
  }

  private void validateItems(List<InvoiceItemRequest> items) {
    if (items == null || items.isEmpty()) {
      throw BookkeepingException.validation("At least one line item is required");
    }
    for (InvoiceItemRequest item : items) {
      if (item == null || trimToNull(item.getDescription()) == null) {
        throw BookkeepingException.validation("All line items must have a description");
      }
      FieldLimits.requireMaxLength(item.getDescription().trim(), InvoiceItem.DESCRIPTION_LENGTH, "Line item description");
      if (item.getQuantity() == null || item.getQuantity() <= 0) {
        throw BookkeepingException.validation("Quantity must be greater than 0");
      }
      if (item.getUnitPrice() == null) {
        throw BookkeepingException.validation("Unit price is required");
      }
      if (item.getUnitPrice() < 0) {
        throw BookkeepingException.validation("Unit price cannot be negative");
      }
    }
  }

  private void requireDateOrder(LocalDate issueDate, LocalDate dueDate) {
    if (dueDate.isBefore(issueDate)) {
      throw BookkeepingException.validation("Due date cannot be before issue date");
    }
  }

  private String validClientEmail(String value) {
    String email = trimToNull(value);
    FieldLimits.requireMaxLength(email, Invoice.CLIENT_EMAIL_LENGTH, "Client email");
    if (email != null && !EmailAddresses.isValid(email)) {
      throw BookkeepingException.validation("Invalid client email format");
    }
    return email;
  }

  private InvoiceItem toItem(InvoiceItemRequest request) {
    InvoiceItem item = new InvoiceItem();
    item.setDescription(request.getDescription().trim());
    item.setQuantity(request.getQuantity());
    item.setUnitPrice(request.getUnitPrice());
    return item;
  }

  private Invoice requireInvoice(UUID userId, UUID invoiceId) {
    return invoiceRepository.findByIdAndUserId(invoiceId, userId)
        .orElseThrow(() -> BookkeepingException.notFound("Invoice not found"));
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value.trim();
    return cleaned.isEmpty() ? null : cleaned;
  }

  private InvoiceResponse toResponse(Invoice invoice) {
    List<InvoiceItemResponse> items = invoice.getItems().stream()
        .map(item -> new InvoiceItemResponse(item.getId(), item.getDescription(), item.getQuantity(), item.getUnitPrice()))
        .toList();
    return new InvoiceResponse(
        invoice.getId(),
        invoice.getInvoiceNumber(),
        invoice.getClientName(),
        invoice.getClientEmail(),
        invoice.getStatus(),
        invoice.getIssueDate(),
        invoice.getDueDate(),
        invoice.getNotes(),
        invoice.getCreatedAt(),
        invoice.getUpdatedAt(),
        items,
        MoneyTotals.invoiceTotal(invoice.getItems())
    );
  }

  private record ItemAmount(int quantity, long unitPrice) implements LineAmount {
    @Override
    public int getQuantity() {
      return quantity;
    }

    @Override
    public long getUnitPrice() {
      return unitPrice;
    }
  }
}
