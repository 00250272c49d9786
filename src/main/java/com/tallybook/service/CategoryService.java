package com.tallybook.service;

import com.tallybook.dto.CategoryRequest;
import com.tallybook.dto.CategoryResponse;
import com.tallybook.model.Category;
import com.tallybook.model.CategoryType;
import com.tallybook.model.User;
import com.tallybook.repository.CategoryRepository;
import com.tallybook.repository.TransactionRepository;
import com.tallybook.repository.UserRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CategoryService {
  static final List<String> DEFAULT_INCOME_CATEGORIES = List.of(
      "Salary",
      "Freelance",
      "Investments",
      "Other Income"
  );
  static final List<String> DEFAULT_EXPENSE_CATEGORIES = List.of(
      "Rent",
      "Utilities",
      "Food",
      "Transportation",
      "Entertainment",
      "Healthcare",
      "Other Expense"
  );

  private final CategoryRepository categoryRepository;
  private final TransactionRepository transactionRepository;
  private final UserRepository userRepository;

  public CategoryService(CategoryRepository categoryRepository,
                         TransactionRepository transactionRepository,
                         UserRepository userRepository) {
    this.categoryRepository = categoryRepository;
    this.transactionRepository = transactionRepository;
    this.userRepository = userRepository;
  }

  @Transactional(readOnly = true)
  public List<CategoryResponse> list(UUID userId, CategoryType type) {
    List<Category> categories = type == null
        ? categoryRepository.findByUserIdOrderByTypeAscNameAsc(userId)
        : categoryRepository.findByUserIdAndTypeOrderByNameAsc(userId, type);
    return categories.stream().map(this::toResponse).toList();
  }

  @Transactional
  public CategoryResponse create(UUID userId, CategoryRequest request) {
    String name = normalizeName(request.getName());
    if (name == null) {
      throw BookkeepingException.validation("Category name is required");
    }
    FieldLimits.requireMaxLength(name, Category.NAME_LENGTH, "Category name");
    if (request.getType() == null) {
      throw BookkeepingException.validation("Category type must be 'income' or 'expense'");
    }
    categoryRepository.findByUserIdAndNameAndType(userId, name, request.getType())
        .ifPresent(existing -> {
          throw duplicate();
        });
    User user = userRepository.findById(userId)
        .orElseThrow(() -> BookkeepingException.notFound("User not found"));
    Category category = new Category();
    category.setUser(user);
    category.setName(name);
    category.setType(request.getType());
    category.setDefaultCategory(false);
    return toResponse(categoryRepository.save(category));
  }

  @Transactional
  public CategoryResponse rename(UUID userId, UUID categoryId, CategoryRequest request) {
    Category category = requireCategory(userId, categoryId);
    if (category.isDefaultCategory()) {
      throw new BookkeepingException(ErrorKind.IMMUTABLE, "Cannot edit default categories");
    }
    String name = normalizeName(request.getName());
    if (name == null) {
      throw BookkeepingException.validation("Category name is required");
    }
    FieldLimits.requireMaxLength(name, Category.NAME_LENGTH, "Category name");
    categoryRepository.findByUserIdAndNameAndType(userId, name, category.getType())
        .filter(existing -> !existing.getId().equals(categoryId))
        .ifPresent(existing -> {
          throw duplicate();
        });
    category.setName(name);
    return toResponse(categoryRepository.save(category));
  }

  @Transactional
  public void delete(UUID userId, UUID categoryId) {
    Category category = requireCategory(userId, categoryId);
    if (category.isDefaultCategory()) {
      throw new BookkeepingException(ErrorKind.IMMUTABLE, "Cannot delete default categories");
    }
    long transactionCount = transactionRepository.countByCategoryId(categoryId);
    if (transactionCount > 0) {
      String usage = transactionCount == 1
          ? "1 transaction uses this category"
          : transactionCount + " transactions use this category";
      throw new BookkeepingException(ErrorKind.IN_USE, "Cannot delete category: " + usage);
    }
    categoryRepository.delete(category);
  }

  @Transactional
  public List<Category> seedDefaults(User user) {
    List<Category> defaults = new ArrayList<>();
    for (String name : DEFAULT_INCOME_CATEGORIES) {
      defaults.add(defaultCategory(user, name, CategoryType.INCOME));
    }
    for (String name : DEFAULT_EXPENSE_CATEGORIES) {
      defaults.add(defaultCategory(user, name, CategoryType.EXPENSE));
    }
    return categoryRepository.saveAll(defaults);
  }

  private Category defaultCategory(User user, String name, CategoryType type) {
    Category category = new Category();
    category.setUser(user);
    category.setName(name);
    category.setType(type);
    category.setDefaultCategory(true);
    return category;
  }

  private Category requireCategory(UUID userId, UUID categoryId) {
    return categoryRepository.findByIdAndUserId(categoryId, userId)
        .orElseThrow(() -> BookkeepingException.notFound("Category not found"));
  }

  private BookkeepingException duplicate() {
    return new BookkeepingException(ErrorKind.DUPLICATE, "A category with this name already exists");
  }

  private String normalizeName(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value.trim();
    return cleaned.isEmpty() ? null : cleaned;
  }

  CategoryResponse toResponse(Category category) {
    return new CategoryResponse(
        category.getId(),
        category.getName(),
        category.getType(),
        category.isDefaultCategory()
    );
  }
}
