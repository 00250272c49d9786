package com.tallybook.service;

import org.springframework.web.server.ResponseStatusException;

public class BookkeepingException extends ResponseStatusException {
  private final ErrorKind kind;

  public BookkeepingException(ErrorKind kind, String message) {
    super(kind.status(), message);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public static BookkeepingException validation(String message) {
    return new BookkeepingException(ErrorKind.VALIDATION, message);
  }

  public static BookkeepingException notFound(String message) {
    return new BookkeepingException(ErrorKind.NOT_FOUND, message);
  }
}
