package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.CategoryRequest;
import com.tallybook.dto.CategoryResponse;
import com.tallybook.model.CategoryType;
import com.tallybook.service.BookkeepingException;
import com.tallybook.service.CategoryService;
import com.tallybook.service.CurrentUserService;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/categories")
public class CategoryController {
  private final CategoryService categoryService;
  private final CurrentUserService currentUserService;

  public CategoryController(CategoryService categoryService, CurrentUserService currentUserService) {
    this.categoryService = categoryService;
    this.currentUserService = currentUserService;
  }

  @GetMapping
  public ActionResult<List<CategoryResponse>> listCategories(
      @RequestParam(name = "type", required = false) String type) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(categoryService.list(userId, parseType(type)));
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ActionResult<CategoryResponse> createCategory(@RequestBody CategoryRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(categoryService.create(userId, request));
  }

  @PatchMapping("/{categoryId}")
  public ActionResult<CategoryResponse> renameCategory(@PathVariable("categoryId") UUID categoryId,
                                                       @RequestBody CategoryRequest request) {
    UUID userId = currentUserService.requireUserId();
    return ActionResult.ok(categoryService.rename(userId, categoryId, request));
  }

  @DeleteMapping("/{categoryId}")
  public ActionResult<Void> deleteCategory(@PathVariable("categoryId") UUID categoryId) {
    UUID userId = currentUserService.requireUserId();
    categoryService.delete(userId, categoryId);
    return ActionResult.ok();
  }

  static CategoryType parseType(String type) {
    if (type == null || type.isBlank()) {
      return null;
    }
    CategoryType parsed = CategoryType.fromWire(type);
    if (parsed == null) {
      throw BookkeepingException.validation("Type must be 'income' or 'expense'");
    }
    return parsed;
  }
}
