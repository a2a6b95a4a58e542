package com.truefi.backend.dto.income;

import java.math.BigDecimal;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomeSummaryDTO {

    private List<RecurringIncomeDTO> recurringIncome;
    private List<RecurringIncomeDTO> activeIncome;
    private BigDecimal totalMonthlyIncome;
    private boolean hasIncome;
}
