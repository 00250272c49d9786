package com.tallybook.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class LinkReceiptRequest {
  @NotNull
  private UUID transactionId;
}
