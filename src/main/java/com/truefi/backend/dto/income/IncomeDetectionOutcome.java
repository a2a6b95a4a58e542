package com.truefi.backend.dto.income;

import java.util.List;

import com.truefi.backend.enums.IncomeRecordState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** What a detect-and-persist run did for the user, and where their income lifecycle now stands. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomeDetectionOutcome {

    private IncomeRecordState state;
    private boolean detected;
    private boolean requiresConfirmation;
    private String message;

    // null when detection was skipped because income is already declared
    private IncomeDetectionResult result;

    private List<RecurringIncomeDTO> activeIncome;
}
