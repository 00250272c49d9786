package com.tallybook.repository;

import com.tallybook.model.Category;
import com.tallybook.model.CategoryType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CategoryRepository extends JpaRepository<Category, UUID> {
  List<Category> findByUserIdOrderByTypeAscNameAsc(UUID userId);

  List<Category> findByUserIdAndTypeOrderByNameAsc(UUID userId, CategoryType type);

  Optional<Category> findByIdAndUserId(UUID id, UUID userId);

  Optional<Category> findByUserIdAndNameAndType(UUID userId, String name, CategoryType type);

  long countByUserId(UUID userId);
}
