package com.tallybook.dto;

import com.tallybook.model.CategoryType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CategoryRequest {
  private String name;
  private CategoryType type;
}
