package com.truefi.backend.dto.goals;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalProgressSummaryDTO {

    private int totalGoals;
    private int onTrack;
    private int completed;
    private BigDecimal averageProgress;
}
