package com.tallybook.repository;

import com.tallybook.model.CategoryType;
import com.tallybook.model.LedgerTransaction;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TransactionRepository
    extends JpaRepository<LedgerTransaction, UUID>, JpaSpecificationExecutor<LedgerTransaction> {

  Optional<LedgerTransaction> findByIdAndUserId(UUID id, UUID userId);

  long countByCategoryId(UUID categoryId);

  @Query("select t from LedgerTransaction t join fetch t.category " +
      "where t.user.id = :userId " +
      "and t.date >= :from and t.date <= :to " +
      "order by t.date asc, t.createdAt asc")
  List<LedgerTransaction> findUserTransactionsInRange(
      @Param("userId") UUID userId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select t from LedgerTransaction t join fetch t.category " +
      "where t.user.id = :userId and t.type = :type " +
      "and t.date >= :from and t.date <= :to")
  List<LedgerTransaction> findUserTransactionsInRangeByType(
      @Param("userId") UUID userId,
      @Param("type") CategoryType type,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query("select t from LedgerTransaction t join fetch t.category " +
      "where t.user.id = :userId " +
      "order by t.date desc, t.createdAt desc")
  List<LedgerTransaction> findRecentForUser(@Param("userId") UUID userId, Pageable pageable);
}
