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
public class IncomeDetectionResult {

    public static final String SOURCE_TRANSACTIONS = "transactions";

    private BigDecimal monthlyIncome;

    // 0-100, only meaningful when monthlyIncome > 0
    private int confidence;

    private String source;

    private Details details;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Details {
        private List<RecurringDepositDTO> recurringDeposits;
    }

    public static IncomeDetectionResult noSignal() {
        return IncomeDetectionResult.builder()
                .monthlyIncome(BigDecimal.ZERO.setScale(2))
                .confidence(0)
                .source(SOURCE_TRANSACTIONS)
                .details(new Details(List.of()))
                .build();
    }

    public boolean hasSignal() {
        return monthlyIncome != null && monthlyIncome.signum() > 0;
    }
}
