package com.tallybook.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "receipts")
@Getter
@Setter
public class Receipt {
  public static final int FILE_NAME_LENGTH = 255;

  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "user_id")
  private User user;

  @ManyToOne
  @JoinColumn(name = "transaction_id")
  private LedgerTransaction transaction;

  @Column(name = "file_path", nullable = false, length = 512)
  private String filePath;

  @Column(name = "file_name", nullable = false, length = FILE_NAME_LENGTH)
  private String fileName;

  @Column(nullable = false)
  private Instant uploadedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (uploadedAt == null) {
      uploadedAt = Instant.now();
    }
  }
}
