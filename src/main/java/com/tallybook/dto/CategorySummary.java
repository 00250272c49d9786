package com.tallybook.dto;

import com.tallybook.model.CategoryType;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CategorySummary {
  private UUID id;
  private String name;
  private CategoryType type;
}
