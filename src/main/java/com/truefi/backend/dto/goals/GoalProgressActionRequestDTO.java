package com.truefi.backend.dto.goals;

import java.math.BigDecimal;

import com.truefi.backend.enums.GoalProgressAction;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class GoalProgressActionRequestDTO {

    @NotNull(message = "action is required")
    private GoalProgressAction action;

    // MANUAL_UPDATE only
    private String goalId;
    private BigDecimal amount;
}
