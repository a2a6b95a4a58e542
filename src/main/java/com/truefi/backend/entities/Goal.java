package com.truefi.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.truefi.backend.enums.GoalFundingSource;
import com.truefi.backend.enums.GoalPriority;

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

@Entity
@Table(name = "goals", indexes = @Index(name = "idx_goal_user", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Goal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal targetAmount;

    @Column(nullable = false, precision = 18, scale = 2)
    @Builder.Default
    private BigDecimal currentAmount = BigDecimal.ZERO;

    private LocalDate targetDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private GoalPriority priority = GoalPriority.MEDIUM;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private GoalFundingSource fundingSource = GoalFundingSource.ACCOUNTS;

    // share of the primary income earmarked for this goal, 0-100
    @Column(precision = 5, scale = 2)
    private BigDecimal incomeAllocationPercent;

    // notification bookkeeping: high-water progress already notified, last on-track flag
    @Column(precision = 9, scale = 2)
    private BigDecimal lastNotifiedPercentage;

    private Boolean lastNotifiedOnTrack;

    @Column(nullable = false)
    @Builder.Default
    private boolean completionNotified = false;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
