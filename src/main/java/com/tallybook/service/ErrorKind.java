package com.tallybook.service;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
  UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
  VALIDATION(HttpStatus.BAD_REQUEST),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  DUPLICATE(HttpStatus.CONFLICT),
  IMMUTABLE(HttpStatus.CONFLICT),
  IN_USE(HttpStatus.CONFLICT),
  INVALID_TRANSITION(HttpStatus.CONFLICT),
  INVALID_REFERENCE(HttpStatus.BAD_REQUEST);

  private final HttpStatus status;

  ErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
