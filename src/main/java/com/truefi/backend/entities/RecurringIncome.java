package com.truefi.backend.entities;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;

import com.truefi.backend.enums.Cadence;
import com.truefi.backend.enums.IncomeRecordState;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A declared or detected monthly income. Records are never deleted: a newer confirmation
 * closes the previous record by setting {@code effectiveTo}.
 */
@Entity
@Table(name = "recurring_income", indexes = @Index(name = "idx_income_user_state", columnList = "user_id, state"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurringIncome {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false)
    private String source;

    @Column(precision = 12, scale = 2)
    private BigDecimal grossMonthly;

    @Column(precision = 12, scale = 2)
    private BigDecimal netMonthly;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Cadence frequency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private IncomeRecordState state = IncomeRecordState.CONFIRMED;

    private Integer confidence;

    private LocalDate nextPayDate;

    @Column(nullable = false)
    private Instant effectiveFrom;

    private Instant effectiveTo;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public boolean isActiveAt(Instant now) {
        return state == IncomeRecordState.CONFIRMED && (effectiveTo == null || effectiveTo.isAfter(now));
    }

    /** Gross when known, otherwise net. */
    public BigDecimal monthlyAmount() {
        if (grossMonthly != null) {
            return grossMonthly;
        }
        return netMonthly != null ? netMonthly : BigDecimal.ZERO;
    }

    public void supersede(Instant at) {
        if (!state.canTransitionTo(IncomeRecordState.SUPERSEDED)) {
            throw new IllegalStateException("Cannot supersede income record in state " + state);
        }
        this.state = IncomeRecordState.SUPERSEDED;
        this.effectiveTo = at;
    }
}
