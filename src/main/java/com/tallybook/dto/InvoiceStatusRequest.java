package com.tallybook.dto;

import com.tallybook.model.InvoiceStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class InvoiceStatusRequest {
  @NotNull
  private InvoiceStatus status;
}
