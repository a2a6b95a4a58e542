package com.truefi.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Daily balance captured by the account sync; one row per account and day. */
@Entity
@Table(
        name = "account_balance_snapshots",
        uniqueConstraints = @UniqueConstraint(name = "uq_snapshot_account_day", columnNames = {"account_id", "captured_on"}),
        indexes = @Index(name = "idx_snapshot_account_day", columnList = "account_id, captured_on")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountBalanceSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal balance;

    @Column(name = "captured_on", nullable = false)
    private LocalDate capturedOn;
}
