package com.tallybook.dto;

import com.tallybook.model.CategoryType;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CategoryResponse {
  private UUID id;
  private String name;
  private CategoryType type;
  private Boolean isDefault;
}
