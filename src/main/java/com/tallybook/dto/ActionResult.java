package com.tallybook.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionResult<T>(boolean success, T data, String error) {
  public static <T> ActionResult<T> ok(T data) {
    return new ActionResult<>(true, data, null);
  }

  public static ActionResult<Void> ok() {
    return new ActionResult<>(true, null, null);
  }

  public static <T> ActionResult<T> failure(String error) {
    return new ActionResult<>(false, null, error);
  }
}
