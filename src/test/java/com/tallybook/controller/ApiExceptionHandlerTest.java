package com.tallybook.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.tallybook.config.StorageProperties;
import com.tallybook.dto.ActionResult;
import com.tallybook.service.BookkeepingException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

class ApiExceptionHandlerTest {
  @Test
  void uploadLimitMessageFollowsConfiguredSize() {
    StorageProperties properties = new StorageProperties("uploads", DataSize.ofMegabytes(8), null);
    ApiExceptionHandler handler = new ApiExceptionHandler(properties);

    ResponseEntity<ActionResult<Void>> response =
        handler.onUploadTooLarge(new MaxUploadSizeExceededException(DataSize.ofMegabytes(10).toBytes()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().success()).isFalse();
    assertThat(response.getBody().error()).isEqualTo("File too large. Maximum size is 8MB.");
  }

  @Test
  void defaultUploadLimitIsFiveMegabytes() {
    ApiExceptionHandler handler = new ApiExceptionHandler(new StorageProperties(null, null, null));

    ResponseEntity<ActionResult<Void>> response =
        handler.onUploadTooLarge(new MaxUploadSizeExceededException(-1));

    assertThat(response.getBody().error()).isEqualTo("File too large. Maximum size is 5MB.");
  }

  @Test
  void bookkeepingFailureKeepsItsStatusAndReason() {
    ApiExceptionHandler handler = new ApiExceptionHandler(new StorageProperties(null, null, null));

    ResponseEntity<ActionResult<Void>> response =
        handler.onBookkeeping(BookkeepingException.notFound("Invoice not found"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().error()).isEqualTo("Invoice not found");
  }
}
