package com.tallybook.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(
    name = "invoices",
    uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "invoice_number"})
)
@Getter
@Setter
public class Invoice {
  public static final int CLIENT_NAME_LENGTH = 255;
  public static final int CLIENT_EMAIL_LENGTH = 255;

  @Id
  private UUID id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "user_id")
  private User user;

  @Column(name = "invoice_number", nullable = false, length = 32)
  private String invoiceNumber;

  @Column(nullable = false, length = CLIENT_NAME_LENGTH)
  private String clientName;

  @Column(length = CLIENT_EMAIL_LENGTH)
  private String clientEmail;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private InvoiceStatus status;

  @Column(nullable = false)
  private LocalDate issueDate;

  @Column(nullable = false)
  private LocalDate dueDate;

  @Column(columnDefinition = "text")
  private String notes;

  @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("position ASC")
  private List<InvoiceItem> items = new ArrayList<>();

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (status == null) {
      status = InvoiceStatus.DRAFT;
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }

  public void addItem(InvoiceItem item) {
    item.setInvoice(this);
    item.setPosition(items.size());
    items.add(item);
  }

  public void touch() {
    updatedAt = Instant.now();
  }
}
