package com.tallybook.service;

import com.tallybook.model.Invoice;
import com.tallybook.model.InvoiceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Invoice status rules.
 *
 * <pre>
 * DRAFT -> SENT -> PAID
 *           |       |
 *           +-------+--(void)--> CANCELLED
 * </pre>
 *
 * PAID only leaves through a void; CANCELLED is terminal. Only DRAFT invoices can be edited or
 * deleted.
 */
@Component
public class InvoiceStateMachine {
  private static final Logger log = LoggerFactory.getLogger(InvoiceStateMachine.class);

  public boolean canTransition(InvoiceStatus from, InvoiceStatus to) {
    if (from == null || to == null) {
      return false;
    }
    return switch (from) {
      case DRAFT -> to == InvoiceStatus.SENT;
      case SENT -> to == InvoiceStatus.PAID;
      case PAID, CANCELLED -> false;
    };
  }

  public boolean canVoid(InvoiceStatus from) {
    return from == InvoiceStatus.SENT || from == InvoiceStatus.PAID;
  }

  public boolean isEditable(InvoiceStatus status) {
    return status == InvoiceStatus.DRAFT;
  }

  public void transition(Invoice invoice, InvoiceStatus newStatus) {
    InvoiceStatus current = invoice.getStatus();
    if (!canTransition(current, newStatus)) {
      throw new BookkeepingException(ErrorKind.INVALID_TRANSITION,
          "Cannot change status from " + current.wireValue() + " to " + newStatus.wireValue());
    }
    invoice.setStatus(newStatus);
    invoice.touch();
    log.info("Invoice {} transitioned: {} -> {}", invoice.getId(), current, newStatus);
  }

  public void voidInvoice(Invoice invoice) {
    InvoiceStatus current = invoice.getStatus();
    if (!canVoid(current)) {
      throw new BookkeepingException(ErrorKind.INVALID_TRANSITION, "Only sent or paid invoices can be voided");
    }
    invoice.setStatus(InvoiceStatus.CANCELLED);
    invoice.touch();
    log.info("Invoice {} voided from {}", invoice.getId(), current);
  }
}
