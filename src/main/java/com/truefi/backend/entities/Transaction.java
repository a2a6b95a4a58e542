package com.truefi.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Normalized bank transaction as produced by the aggregation sync. Read-only for this service.
 * {@code amount} is signed: positive means money flowing into the account.
 */
@Entity
@Table(
        name = "transactions",
        indexes = {
                @Index(name = "idx_tx_user_posted", columnList = "user_id, posted_date")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Transaction {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(length = 3)
    @Builder.Default
    private String currency = "USD";

    @Column(name = "posted_date", nullable = false)
    private LocalDate postedDate;

    private String merchantName;

    @Column(nullable = false)
    private String rawDescription;

    private String category;

    @Column(nullable = false)
    private boolean pending;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    /** Merchant name when the aggregator resolved one, otherwise the raw bank description. */
    public String displayName() {
        if (merchantName != null && !merchantName.isBlank()) {
            return merchantName;
        }
        return rawDescription != null ? rawDescription : "";
    }
}
