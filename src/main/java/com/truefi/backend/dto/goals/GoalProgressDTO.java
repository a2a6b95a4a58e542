package com.truefi.backend.dto.goals;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalProgressDTO {

    private String goalId;
    private String name;

    private BigDecimal targetAmount;
    private BigDecimal currentAmount;

    // not clamped at 100, the display layer decides
    private BigDecimal progressPercentage;

    private boolean onTrack;

    // false when targetAmount <= 0; no projection is made for such goals
    private boolean validTarget;

    private LocalDate targetDate;
    private LocalDate projectedCompletionDate;
    private BigDecimal requiredMonthlyContribution;
    private BigDecimal observedMonthlyContribution;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    public boolean isCompleted() {
        return validTarget && progressPercentage != null
                && progressPercentage.compareTo(BigDecimal.valueOf(100)) >= 0;
    }
}
