package com.tallybook.repository;

import com.tallybook.model.Receipt;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReceiptRepository extends JpaRepository<Receipt, UUID> {
  Optional<Receipt> findByIdAndUserId(UUID id, UUID userId);

  List<Receipt> findByTransactionIdAndUserIdOrderByUploadedAtDesc(UUID transactionId, UUID userId);

  Optional<Receipt> findFirstByUserIdAndFilePath(UUID userId, String filePath);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update Receipt r set r.transaction = null where r.transaction.id = :transactionId")
  int detachFromTransaction(@Param("transactionId") UUID transactionId);
}
