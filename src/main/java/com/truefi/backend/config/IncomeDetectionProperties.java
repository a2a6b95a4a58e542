package com.truefi.backend.config;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "truefi.income")
public record IncomeDetectionProperties(
        Integer lookbackDays,
        BigDecimal amountToleranceRatio,
        Double similarityThreshold,
        Integer minimumConfidence,
        Integer autoPersistConfidence,
        BigDecimal minimumUncategorizedAmount,
        List<String> incomeKeywords,
        List<String> payrollKeywords,
        List<String> internalTransferCategories
) {
    public IncomeDetectionProperties {
        if (lookbackDays == null) {
            lookbackDays = 90;
        }
        if (amountToleranceRatio == null) {
            amountToleranceRatio = new BigDecimal("0.10");
        }
        if (similarityThreshold == null) {
            similarityThreshold = 0.6;
        }
        if (minimumConfidence == null) {
            minimumConfidence = 40;
        }
        if (autoPersistConfidence == null) {
            autoPersistConfidence = 60;
        }
        if (minimumUncategorizedAmount == null) {
            minimumUncategorizedAmount = new BigDecimal("500");
        }
        if (incomeKeywords == null || incomeKeywords.isEmpty()) {
            incomeKeywords = List.of("transfer", "payroll", "deposit", "salary", "wages", "income");
        }
        if (payrollKeywords == null || payrollKeywords.isEmpty()) {
            payrollKeywords = List.of("payroll", "salary", "direct dep", "wages", "paycheck", "earnings");
        }
        if (internalTransferCategories == null) {
            internalTransferCategories = List.of(
                    "internal transfer",
                    "account transfer",
                    "transfer between accounts",
                    "credit card payment"
            );
        }
    }

    public static IncomeDetectionProperties defaults() {
        return new IncomeDetectionProperties(null, null, null, null, null, null, null, null, null);
    }
}
