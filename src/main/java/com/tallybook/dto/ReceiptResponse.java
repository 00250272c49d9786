package com.tallybook.dto;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ReceiptResponse {
  private UUID id;
  private String fileName;
  private String filePath;
  private Instant uploadedAt;
  private UUID transactionId;
}
