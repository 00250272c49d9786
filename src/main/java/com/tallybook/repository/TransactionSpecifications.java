package com.tallybook.repository;

import com.tallybook.model.LedgerTransaction;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

public final class TransactionSpecifications {
  private TransactionSpecifications() {
  }

  public static Specification<LedgerTransaction> matching(UUID userId,
                                                          LocalDate from,
                                                          LocalDate to,
                                                          Collection<UUID> categoryIds) {
    return (root, query, cb) -> {
      List<Predicate> predicates = new ArrayList<>();
      predicates.add(cb.equal(root.get("user").get("id"), userId));
      if (from != null) {
        predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("date"), from));
      }
      if (to != null) {
        predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("date"), to));
      }
      if (categoryIds != null && !categoryIds.isEmpty()) {
        predicates.add(root.get("category").get("id").in(categoryIds));
      }
      return cb.and(predicates.toArray(new Predicate[0]));
    };
  }
}
