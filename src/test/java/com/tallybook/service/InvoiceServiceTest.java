package com.tallybook.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tallybook.dto.CreateInvoiceRequest;
import com.tallybook.dto.InvoiceCreatedResponse;
import com.tallybook.dto.InvoiceItemRequest;
import com.tallybook.dto.InvoiceListItem;
import com.tallybook.dto.InvoiceResponse;
import com.tallybook.dto.UpdateInvoiceRequest;
import com.tallybook.model.Invoice;
import com.tallybook.model.InvoiceItem;
import com.tallybook.model.InvoiceStatus;
import com.tallybook.model.User;
import com.tallybook.repository.InvoiceRepository;
import com.tallybook.repository.UserRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {
  private static final LocalDate ISSUED = LocalDate.of(2024, 4, 1);
  private static final LocalDate DUE = LocalDate.of(2024, 4, 30);

  @Mock
  private InvoiceRepository invoiceRepository;

  @Mock
  private UserRepository userRepository;

  private InvoiceService invoiceService;
  private UUID userId;
  private User user;

  @BeforeEach
  void setUp() {
    invoiceService = new InvoiceService(invoiceRepository, userRepository, new InvoiceStateMachine());
    userId = UUID.randomUUID();
    user = new User();
    user.setId(userId);
  }

  @Test
  void createValidatesBeforeTouchingTheStore() {
    assertValidation(createRequest(" ", item("Design", 1, 100L)), "Client name is required");

    CreateInvoiceRequest backwards = createRequest("Acme", item("Design", 1, 100L));
    backwards.setDueDate(ISSUED.minusDays(1));
    assertValidation(backwards, "Due date cannot be before issue date");

    CreateInvoiceRequest badEmail = createRequest("Acme", item("Design", 1, 100L));
    badEmail.setClientEmail("not-an-email");
    assertValidation(badEmail, "Invalid client email format");

    assertValidation(createRequest("Acme"), "At least one line item is required");
    assertValidation(createRequest("Acme", item(" ", 1, 100L)), "All line items must have a description");
    assertValidation(createRequest("Acme", item("Design", 0, 100L)), "Quantity must be greater than 0");
    assertValidation(createRequest("Acme", item("Design", 1, -1L)), "Unit price cannot be negative");
    assertValidation(createRequest("Acme", item("Design", 1, null)), "Unit price is required");
    assertValidation(createRequest("a".repeat(256), item("Design", 1, 100L)),
        "Client name must be at most 255 characters");
    assertValidation(createRequest("Acme", item("d".repeat(256), 1, 100L)),
        "Line item description must be at most 255 characters");

    verifyNoInteractions(invoiceRepository, userRepository);
  }

  @Test
  void createNumbersFromCountAndStoresDraftWithOrderedItems() {
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(invoiceRepository.countByUserId(userId)).thenReturn(2L);
    when(invoiceRepository.existsByUserIdAndInvoiceNumber(userId, "INV-003")).thenReturn(false);
    when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

    InvoiceCreatedResponse response = invoiceService.create(userId,
        createRequest("Acme", item("Design", 2, 5000L), item("Hosting", 1, 2500L)));

    assertThat(response.getInvoiceNumber()).isEqualTo("INV-003");
    ArgumentCaptor<Invoice> captor = ArgumentCaptor.forClass(Invoice.class);
    verify(invoiceRepository).save(captor.capture());
    Invoice saved = captor.getValue();
    assertThat(saved.getStatus()).isEqualTo(InvoiceStatus.DRAFT);
    assertThat(saved.getItems()).extracting(InvoiceItem::getDescription).containsExactly("Design", "Hosting");
    assertThat(saved.getItems()).extracting(InvoiceItem::getPosition).containsExactly(0, 1);
    assertThat(saved.getItems()).allMatch(item -> item.getInvoice() == saved);
    assertThat(MoneyTotals.invoiceTotal(saved.getItems())).isEqualTo(12500);
  }

  @Test
  void nextNumberSkipsNumbersAlreadyTaken() {
    when(invoiceRepository.countByUserId(userId)).thenReturn(1L);
    when(invoiceRepository.existsByUserIdAndInvoiceNumber(userId, "INV-002")).thenReturn(true);
    when(invoiceRepository.existsByUserIdAndInvoiceNumber(userId, "INV-003")).thenReturn(false);

    assertThat(invoiceService.nextInvoiceNumber(userId)).isEqualTo("INV-003");
  }

  @Test
  void numbersArePaddedToThreeDigits() {
    assertThat(InvoiceService.formatNumber(1)).isEqualTo("INV-001");
    assertThat(InvoiceService.formatNumber(42)).isEqualTo("INV-042");
    assertThat(InvoiceService.formatNumber(1234)).isEqualTo("INV-1234");
  }

  @Test
  void updateReplacesAllItemsOfDraft() {
    Invoice invoice = invoice(InvoiceStatus.DRAFT);
    invoice.addItem(lineItem("Old one", 1, 100L));
    invoice.addItem(lineItem("Old two", 1, 200L));
    when(invoiceRepository.findByIdAndUserId(invoice.getId(), userId)).thenReturn(Optional.of(invoice));

    UpdateInvoiceRequest request = new UpdateInvoiceRequest();
    request.setItems(List.of(item("Consulting", 3, 10000L)));
    InvoiceResponse response = invoiceService.update(userId, invoice.getId(), request);

    assertThat(response.getItems()).hasSize(1);
    assertThat(response.getItems().get(0).getDescription()).isEqualTo("Consulting");
    assertThat(response.getTotal()).isEqualTo(30000);
    assertThat(response.getClientName()).isEqualTo("Acme");
    verify(invoiceRepository).flush();
  }

  @Test
  void updateWithOverlongItemDescriptionKeepsExistingLines() {
    Invoice invoice = invoice(InvoiceStatus.DRAFT);
    invoice.addItem(lineItem("Design", 2, 5000L));
    when(invoiceRepository.findByIdAndUserId(invoice.getId(), userId)).thenReturn(Optional.of(invoice));

    UpdateInvoiceRequest request = new UpdateInvoiceRequest();
    request.setClientName("Renamed");
    request.setItems(List.of(item("d".repeat(300), 1, 100L)));
    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.update(userId, invoice.getId(), request), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(ex.getReason()).isEqualTo("Line item description must be at most 255 characters");
    assertThat(invoice.getClientName()).isEqualTo("Acme");
    assertThat(invoice.getItems()).extracting(InvoiceItem::getDescription).containsExactly("Design");
  }

  @Test
  void updateRejectsOverlongClientName() {
    Invoice invoice = invoice(InvoiceStatus.DRAFT);
    when(invoiceRepository.findByIdAndUserId(invoice.getId(), userId)).thenReturn(Optional.of(invoice));

    UpdateInvoiceRequest request = new UpdateInvoiceRequest();
    request.setClientName("c".repeat(256));
    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.update(userId, invoice.getId(), request), BookkeepingException.class);

    assertThat(ex.getReason()).isEqualTo("Client name must be at most 255 characters");
    assertThat(invoice.getClientName()).isEqualTo("Acme");
  }

  @Test
  void updateOfSentInvoiceIsRejected() {
    Invoice invoice = invoice(InvoiceStatus.SENT);
    invoice.addItem(lineItem("Design", 1, 100L));
    when(invoiceRepository.findByIdAndUserId(invoice.getId(), userId)).thenReturn(Optional.of(invoice));

    UpdateInvoiceRequest request = new UpdateInvoiceRequest();
    request.setClientName("Someone else");
    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.update(userId, invoice.getId(), request), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.IMMUTABLE);
    assertThat(invoice.getClientName()).isEqualTo("Acme");
    assertThat(invoice.getItems()).hasSize(1);
  }

  @Test
  void statusUpdateFollowsStateMachine() {
    Invoice invoice = invoice(InvoiceStatus.DRAFT);
    when(invoiceRepository.findByIdAndUserId(invoice.getId(), userId)).thenReturn(Optional.of(invoice));

    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.updateStatus(userId, invoice.getId(), InvoiceStatus.PAID), BookkeepingException.class);
    assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_TRANSITION);

    InvoiceResponse sent = invoiceService.updateStatus(userId, invoice.getId(), InvoiceStatus.SENT);
    assertThat(sent.getStatus()).isEqualTo(InvoiceStatus.SENT);
  }

  @Test
  void missingStatusIsValidationError() {
    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.updateStatus(userId, UUID.randomUUID(), null), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
  }

  @Test
  void onlyDraftsCanBeDeleted() {
    Invoice invoice = invoice(InvoiceStatus.PAID);
    when(invoiceRepository.findByIdAndUserId(invoice.getId(), userId)).thenReturn(Optional.of(invoice));

    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.delete(userId, invoice.getId()), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.IMMUTABLE);
    verify(invoiceRepository, never()).delete(any());
  }

  @Test
  void listComputesTotalsFromLineAmounts() {
    Invoice first = invoice(InvoiceStatus.SENT);
    Invoice second = invoice(InvoiceStatus.DRAFT);
    List<Object[]> rows = new ArrayList<>();
    rows.add(new Object[] {first.getId(), 2, 5000L});
    rows.add(new Object[] {first.getId(), 1, 2500L});
    when(invoiceRepository.findLineAmountsForUser(userId)).thenReturn(rows);
    when(invoiceRepository.findByUserIdOrderByIssueDateDesc(userId)).thenReturn(List.of(first, second));

    List<InvoiceListItem> invoices = invoiceService.list(userId);

    assertThat(invoices).extracting(InvoiceListItem::getTotal).containsExactly(12500L, 0L);
  }

  private void assertValidation(CreateInvoiceRequest request, String message) {
    BookkeepingException ex = catchThrowableOfType(
        () -> invoiceService.create(userId, request), BookkeepingException.class);
    assertThat(ex).as(message).isNotNull();
    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(ex.getReason()).isEqualTo(message);
  }

  private Invoice invoice(InvoiceStatus status) {
    Invoice invoice = new Invoice();
    invoice.setId(UUID.randomUUID());
    invoice.setUser(user);
    invoice.setInvoiceNumber("INV-001");
    invoice.setClientName("Acme");
    invoice.setStatus(status);
    invoice.setIssueDate(ISSUED);
    invoice.setDueDate(DUE);
    return invoice;
  }

  private static CreateInvoiceRequest createRequest(String clientName, InvoiceItemRequest... items) {
    CreateInvoiceRequest request = new CreateInvoiceRequest();
    request.setClientName(clientName);
    request.setIssueDate(ISSUED);
    request.setDueDate(DUE);
    request.setItems(List.of(items));
    return request;
  }

  private static InvoiceItemRequest item(String description, int quantity, Long unitPrice) {
    InvoiceItemRequest item = new InvoiceItemRequest();
    item.setDescription(description);
    item.setQuantity(quantity);
    item.setUnitPrice(unitPrice);
    return item;
  }

  private static InvoiceItem lineItem(String description, int quantity, long unitPrice) {
    InvoiceItem item = new InvoiceItem();
    item.setDescription(description);
    item.setQuantity(quantity);
    item.setUnitPrice(unitPrice);
    return item;
  }
}
