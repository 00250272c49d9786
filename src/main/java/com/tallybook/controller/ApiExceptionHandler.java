package com.tallybook.controller;

import com.tallybook.config.StorageProperties;
import com.tallybook.dto.ActionResult;
import com.tallybook.service.BookkeepingException;
import com.tallybook.service.ReceiptService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String GENERIC_ERROR = "Something went wrong";

  private final StorageProperties storageProperties;

  public ApiExceptionHandler(StorageProperties storageProperties) {
    this.storageProperties = storageProperties;
  }

  @ExceptionHandler(BookkeepingException.class)
  public ResponseEntity<ActionResult<Void>> onBookkeeping(BookkeepingException ex) {
    return ResponseEntity.status(ex.getKind().status()).body(ActionResult.failure(ex.getReason()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ActionResult<Void>> onStatus(ResponseStatusException ex) {
    String reason = ex.getReason() == null ? GENERIC_ERROR : ex.getReason();
    return ResponseEntity.status(ex.getStatusCode()).body(ActionResult.failure(reason));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ActionResult<Void>> onInvalid(MethodArgumentNotValidException ex) {
    FieldError fieldError = ex.getBindingResult().getFieldError();
    String message = fieldError == null
        ? "Invalid request"
        : fieldError.getField() + " " + fieldError.getDefaultMessage();
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ActionResult<Void>> onUnreadable(HttpMessageNotReadableException ex) {
    return badRequest("Malformed request body");
  }

  @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
  public ResponseEntity<ActionResult<Void>> onMissing(Exception ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ActionResult<Void>> onTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest("Invalid value for " + ex.getName());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ActionResult<Void>> onUploadTooLarge(MaxUploadSizeExceededException ex) {
    return badRequest(ReceiptService.tooLargeMessage(storageProperties));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ActionResult<Void>> onMethod(HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(ActionResult.failure(ex.getMessage()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ActionResult<Void>> onNoResource(NoResourceFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ActionResult.failure("Not found"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ActionResult<Void>> onUnexpected(Exception ex) {
    log.error("Unhandled failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ActionResult.failure(GENERIC_ERROR));
  }

  private ResponseEntity<ActionResult<Void>> badRequest(String message) {
    return ResponseEntity.badRequest().body(ActionResult.failure(message));
  }
}
