package com.tallybook.repository;

import com.tallybook.model.Invoice;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {
  Optional<Invoice> findByIdAndUserId(UUID id, UUID userId);

  List<Invoice> findByUserIdOrderByIssueDateDesc(UUID userId);

  long countByUserId(UUID userId);

  boolean existsByUserIdAndInvoiceNumber(UUID userId, String invoiceNumber);

  @Query("select i.invoice.id, i.quantity, i.unitPrice from InvoiceItem i where i.invoice.user.id = :userId")
  List<Object[]> findLineAmountsForUser(@Param("userId") UUID userId);
}
