package com.tallybook.service;

import com.tallybook.dto.CategorySummary;
import com.tallybook.dto.CreateTransactionRequest;
import com.tallybook.dto.DashboardSummary;
import com.tallybook.dto.PaginatedTransactions;
import com.tallybook.dto.TransactionFilter;
import com.tallybook.dto.TransactionResponse;
import com.tallybook.dto.TransactionTotals;
import com.tallybook.dto.UpdateTransactionRequest;
import com.tallybook.model.Category;
import com.tallybook.model.CategoryType;
import com.tallybook.model.LedgerTransaction;
import com.tallybook.model.User;
import com.tallybook.repository.CategoryRepository;
import com.tallybook.repository.ReceiptRepository;
import com.tallybook.repository.TransactionRepository;
import com.tallybook.repository.TransactionSpecifications;
import com.tallybook.repository.UserRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TransactionService {
  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_LIMIT = 20;
  private static final int MAX_LIMIT = 100;
  private static final int RECENT_COUNT = 5;
  private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("date"), Sort.Order.desc("createdAt"));

  private final TransactionRepository transactionRepository;
  private final CategoryRepository categoryRepository;
  private final ReceiptRepository receiptRepository;
  private final UserRepository userRepository;
  private final Clock clock;

  public TransactionService(TransactionRepository transactionRepository,
                            CategoryRepository categoryRepository,
                            ReceiptRepository receiptRepository,
                            UserRepository userRepository,
                            Clock clock) {
    this.transactionRepository = transactionRepository;
    this.categoryRepository = categoryRepository;
    this.receiptRepository = receiptRepository;
    this.userRepository = userRepository;
    this.clock = clock;
  }

  @Transactional
  public TransactionResponse create(UUID userId, CreateTransactionRequest request) {
    if (request.getType() == null) {
      throw BookkeepingException.validation("Transaction type must be 'income' or 'expense'");
    }
    long amount = requireAmount(request.getAmount());
    if (request.getCategoryId() == null) {
      throw BookkeepingException.validation("Category is required");
    }
    if (request.getDate() == null) {
      throw BookkeepingException.validation("Date is required");
    }
    String description = normalizeDescription(request.getDescription());
    Category category = requireCategory(userId, request.getCategoryId());
    requireMatchingType(request.getType(), category);
    User user = userRepository.findById(userId)
        .orElseThrow(() -> BookkeepingException.notFound("User not found"));

    LedgerTransaction tx = new LedgerTransaction();
    tx.setUser(user);
    tx.setType(request.getType());
    tx.setAmount(amount);
    tx.setDescription(description);
    tx.setCategory(category);
    tx.setDate(request.getDate());
    return toResponse(transactionRepository.save(tx));
  }

  @Transactional(readOnly = true)
  public TransactionResponse get(UUID userId, UUID transactionId) {
    return toResponse(requireTransaction(userId, transactionId));
  }

  @Transactional
  public TransactionResponse update(UUID userId, UUID transactionId, UpdateTransactionRequest request) {
    LedgerTransaction tx = requireTransaction(userId, transactionId);
    Category category = request.getCategoryId() == null
        ? tx.getCategory()
        : requireCategory(userId, request.getCategoryId());
    Long amount = request.getAmount() == null ? null : requireAmount(request.getAmount());
    String description = request.getDescription() == null ? null : normalizeDescription(request.getDescription());
    CategoryType type = request.getType() == null ? tx.getType() : request.getType();
    requireMatchingType(type, category);

    if (request.getType() != null) {
      tx.setType(request.getType());
    }
    if (amount != null) {
      tx.setAmount(amount);
    }
    if (request.getDescription() != null) {
      tx.setDescription(description);
    }
    if (request.getCategoryId() != null) {
      tx.setCategory(category);
    }
    if (request.getDate() != null) {
      tx.setDate(request.getDate());
    }
    transactionRepository.flush();
    return toResponse(tx);
  }

  @Transactional
  public void delete(UUID userId, UUID transactionId) {
    LedgerTransaction tx = requireTransaction(userId, transactionId);
    receiptRepository.detachFromTransaction(tx.getId());
    transactionRepository.delete(tx);
  }

  @Transactional(readOnly = true)
  public PaginatedTransactions list(UUID userId, TransactionFilter filter, int page, int limit) {
    if (page < 1) {
      throw BookkeepingException.validation("Page must be 1 or greater");
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw BookkeepingException.validation("Limit must be between 1 and " + MAX_LIMIT);
    }
    Page<LedgerTransaction> result = transactionRepository.findAll(
        specification(userId, filter),
        PageRequest.of(page - 1, limit, NEWEST_FIRST));
    long total = result.getTotalElements();
    int totalPages = (int) ((total + limit - 1) / limit);
    List<TransactionResponse> transactions = result.getContent().stream().map(this::toResponse).toList();
    return new PaginatedTransactions(transactions, total, page, totalPages);
  }

  @Transactional(readOnly = true)
  public TransactionTotals totals(UUID userId, TransactionFilter filter) {
    return MoneyTotals.transactionTotals(transactionRepository.findAll(specification(userId, filter)));
  }

  @Transactional(readOnly = true)
  public DashboardSummary dashboardSummary(UUID userId) {
    YearMonth month = YearMonth.now(clock);
    LocalDate from = month.atDay(1);
    LocalDate to = month.atEndOfMonth();
    TransactionTotals totals = MoneyTotals.transactionTotals(
        transactionRepository.findUserTransactionsInRange(userId, from, to));
    List<TransactionResponse> recent = transactionRepository
        .findRecentForUser(userId, PageRequest.of(0, RECENT_COUNT))
        .stream()
        .map(this::toResponse)
        .toList();
    return new DashboardSummary(totals.income(), totals.expense(), totals.net(), recent);
  }

  private Specification<LedgerTransaction> specification(UUID userId, TransactionFilter filter) {
    TransactionFilter effective = filter == null ? TransactionFilter.none() : filter;
    return TransactionSpecifications.matching(
        userId,
        effective.startDate(),
        effective.endDate(),
        effective.categoryIds());
  }

  private LedgerTransaction requireTransaction(UUID userId, UUID transactionId) {
    return transactionRepository.findByIdAndUserId(transactionId, userId)
        .orElseThrow(() -> BookkeepingException.notFound("Transaction not found"));
  }

  private Category requireCategory(UUID userId, UUID categoryId) {
    return categoryRepository.findByIdAndUserId(categoryId, userId)
        .orElseThrow(() -> new BookkeepingException(ErrorKind.INVALID_REFERENCE, "Invalid category"));
  }

  private void requireMatchingType(CategoryType type, Category category) {
    if (category.getType() != type) {
      throw new BookkeepingException(ErrorKind.INVALID_REFERENCE,
          "Category " + category.getName() + " is not an " + type.wireValue() + " category");
    }
  }

  private long requireAmount(BigDecimal amount) {
    if (amount == null || amount.signum() <= 0) {
      throw BookkeepingException.validation("Amount must be a positive number");
    }
    BigDecimal rounded = amount.setScale(0, RoundingMode.HALF_UP);
    if (rounded.signum() <= 0) {
      throw BookkeepingException.validation("Amount must be a positive number");
    }
    try {
      return rounded.longValueExact();
    } catch (ArithmeticException ex) {
      throw BookkeepingException.validation("Amount is too large");
    }
  }

  private String normalizeDescription(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value.trim();
    FieldLimits.requireMaxLength(cleaned, LedgerTransaction.DESCRIPTION_LENGTH, "Description");
    return cleaned.isEmpty() ? null : cleaned;
  }

  TransactionResponse toResponse(LedgerTransaction tx) {
    Category category = tx.getCategory();
    return new TransactionResponse(
        tx.getId(),
        tx.getType(),
        tx.getAmount(),
        tx.getDescription(),
        category.getId(),
        tx.getDate(),
        tx.getCreatedAt(),
        tx.getUpdatedAt(),
        new CategorySummary(category.getId(), category.getName(), category.getType())
    );
  }
}
