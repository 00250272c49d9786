package com.tallybook.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tallybook.dto.CategoryRequest;
import com.tallybook.dto.CategoryResponse;
import com.tallybook.model.Category;
import com.tallybook.model.CategoryType;
import com.tallybook.model.User;
import com.tallybook.repository.CategoryRepository;
import com.tallybook.repository.TransactionRepository;
import com.tallybook.repository.UserRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {
  @Mock
  private CategoryRepository categoryRepository;

  @Mock
  private TransactionRepository transactionRepository;

  @Mock
  private UserRepository userRepository;

  @InjectMocks
  private CategoryService categoryService;

  private UUID userId;
  private User user;

  @BeforeEach
  void setUp() {
    userId = UUID.randomUUID();
    user = new User();
    user.setId(userId);
    user.setEmail("owner@example.com");
  }

  @Test
  void createRejectsBlankName() {
    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.create(userId, request("   ", CategoryType.EXPENSE)), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(ex.getReason()).isEqualTo("Category name is required");
    verifyNoInteractions(categoryRepository);
  }

  @Test
  void createRejectsMissingType() {
    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.create(userId, request("Travel", null)), BookkeepingException.class);

    assertThat(ex.getReason()).isEqualTo("Category type must be 'income' or 'expense'");
  }

  @Test
  void createRejectsDuplicateNameOfSameType() {
    Category existing = category("Travel", CategoryType.EXPENSE, false);
    when(categoryRepository.findByUserIdAndNameAndType(userId, "Travel", CategoryType.EXPENSE))
        .thenReturn(Optional.of(existing));

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.create(userId, request(" Travel ", CategoryType.EXPENSE)), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.DUPLICATE);
    verify(categoryRepository, never()).save(any());
  }

  @Test
  void createStoresTrimmedCustomCategory() {
    when(categoryRepository.findByUserIdAndNameAndType(userId, "Travel", CategoryType.EXPENSE))
        .thenReturn(Optional.empty());
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

    CategoryResponse response = categoryService.create(userId, request(" Travel ", CategoryType.EXPENSE));

    assertThat(response.getName()).isEqualTo("Travel");
    assertThat(response.getType()).isEqualTo(CategoryType.EXPENSE);
    assertThat(response.getIsDefault()).isFalse();
  }

  @Test
  void defaultCategoriesCannotBeRenamed() {
    Category rent = category("Rent", CategoryType.EXPENSE, true);
    when(categoryRepository.findByIdAndUserId(rent.getId(), userId)).thenReturn(Optional.of(rent));

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.rename(userId, rent.getId(), request("Housing", null)), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.IMMUTABLE);
    assertThat(rent.getName()).isEqualTo("Rent");
  }

  @Test
  void renameKeepsType() {
    Category travel = category("Travel", CategoryType.EXPENSE, false);
    when(categoryRepository.findByIdAndUserId(travel.getId(), userId)).thenReturn(Optional.of(travel));
    when(categoryRepository.findByUserIdAndNameAndType(userId, "Trips", CategoryType.EXPENSE))
        .thenReturn(Optional.empty());
    when(categoryRepository.save(travel)).thenReturn(travel);

    CategoryResponse response = categoryService.rename(userId, travel.getId(), request("Trips", CategoryType.INCOME));

    assertThat(response.getName()).isEqualTo("Trips");
    assertThat(response.getType()).isEqualTo(CategoryType.EXPENSE);
  }

  @Test
  void createRejectsNameLongerThanColumn() {
    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.create(userId, request("x".repeat(81), CategoryType.EXPENSE)),
        BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(ex.getReason()).isEqualTo("Category name must be at most 80 characters");
    verifyNoInteractions(categoryRepository, userRepository);
  }

  @Test
  void createAcceptsNameOfExactlyColumnLength() {
    String name = "x".repeat(Category.NAME_LENGTH);
    when(categoryRepository.findByUserIdAndNameAndType(userId, name, CategoryType.INCOME)).thenReturn(Optional.empty());
    when(userRepository.findById(userId)).thenReturn(Optional.of(user));
    when(categoryRepository.save(any(Category.class))).thenAnswer(inv -> inv.getArgument(0));

    CategoryResponse response = categoryService.create(userId, request(name, CategoryType.INCOME));

    assertThat(response.getName()).hasSize(80);
  }

  @Test
  void renameRejectsNameLongerThanColumn() {
    Category travel = category("Travel", CategoryType.EXPENSE, false);
    when(categoryRepository.findByIdAndUserId(travel.getId(), userId)).thenReturn(Optional.of(travel));

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.rename(userId, travel.getId(), request("y".repeat(81), null)),
        BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(travel.getName()).isEqualTo("Travel");
    verify(categoryRepository, never()).save(any(Category.class));
  }

  @Test
  void unknownCategoryIsNotFound() {
    UUID missing = UUID.randomUUID();
    when(categoryRepository.findByIdAndUserId(missing, userId)).thenReturn(Optional.empty());

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.delete(userId, missing), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
  }

  @Test
  void defaultCategoriesCannotBeDeleted() {
    Category salary = category("Salary", CategoryType.INCOME, true);
    when(categoryRepository.findByIdAndUserId(salary.getId(), userId)).thenReturn(Optional.of(salary));

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.delete(userId, salary.getId()), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.IMMUTABLE);
    assertThat(ex.getReason()).isEqualTo("Cannot delete default categories");
    verify(categoryRepository, never()).delete(any());
  }

  @Test
  void categoriesInUseCannotBeDeleted() {
    Category travel = category("Travel", CategoryType.EXPENSE, false);
    when(categoryRepository.findByIdAndUserId(travel.getId(), userId)).thenReturn(Optional.of(travel));
    when(transactionRepository.countByCategoryId(travel.getId())).thenReturn(3L);

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.delete(userId, travel.getId()), BookkeepingException.class);

    assertThat(ex.getKind()).isEqualTo(ErrorKind.IN_USE);
    assertThat(ex.getReason()).isEqualTo("Cannot delete category: 3 transactions use this category");
    verify(categoryRepository, never()).delete(any());
  }

  @Test
  void singleUsageIsReportedInSingular() {
    Category travel = category("Travel", CategoryType.EXPENSE, false);
    when(categoryRepository.findByIdAndUserId(travel.getId(), userId)).thenReturn(Optional.of(travel));
    when(transactionRepository.countByCategoryId(travel.getId())).thenReturn(1L);

    BookkeepingException ex = catchThrowableOfType(
        () -> categoryService.delete(userId, travel.getId()), BookkeepingException.class);

    assertThat(ex.getReason()).isEqualTo("Cannot delete category: 1 transaction uses this category");
  }

  @Test
  void unusedCustomCategoryIsDeleted() {
    Category travel = category("Travel", CategoryType.EXPENSE, false);
    when(categoryRepository.findByIdAndUserId(travel.getId(), userId)).thenReturn(Optional.of(travel));
    when(transactionRepository.countByCategoryId(travel.getId())).thenReturn(0L);

    categoryService.delete(userId, travel.getId());

    verify(categoryRepository).delete(travel);
  }

  @Test
  @SuppressWarnings("unchecked")
  void seedDefaultsInsertsElevenDefaultsInOneBatch() {
    when(categoryRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

    List<Category> seeded = categoryService.seedDefaults(user);

    ArgumentCaptor<List<Category>> captor = ArgumentCaptor.forClass(List.class);
    verify(categoryRepository).saveAll(captor.capture());
    assertThat(captor.getValue()).hasSize(11);
    assertThat(seeded).allMatch(Category::isDefaultCategory).allMatch(c -> c.getUser() == user);
    assertThat(seeded).filteredOn(c -> c.getType() == CategoryType.INCOME)
        .extracting(Category::getName)
        .containsExactly("Salary", "Freelance", "Investments", "Other Income");
    assertThat(seeded).filteredOn(c -> c.getType() == CategoryType.EXPENSE).hasSize(7);
  }

  @Test
  void listFiltersByTypeWhenGiven() {
    when(categoryRepository.findByUserIdAndTypeOrderByNameAsc(userId, CategoryType.INCOME))
        .thenReturn(List.of(category("Salary", CategoryType.INCOME, true)));

    List<CategoryResponse> categories = categoryService.list(userId, CategoryType.INCOME);

    assertThat(categories).extracting(CategoryResponse::getName).containsExactly("Salary");
  }

  private Category category(String name, CategoryType type, boolean isDefault) {
    Category category = new Category();
    category.setId(UUID.randomUUID());
    category.setUser(user);
    category.setName(name);
    category.setType(type);
    category.setDefaultCategory(isDefault);
    return category;
  }

  private static CategoryRequest request(String name, CategoryType type) {
    CategoryRequest request = new CategoryRequest();
    request.setName(name);
    request.setType(type);
    return request;
  }
}
