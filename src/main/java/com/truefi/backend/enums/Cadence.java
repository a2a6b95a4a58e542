package com.truefi.backend.enums;

import java.math.BigDecimal;

public enum Cadence {
    WEEKLY(7, 2, new BigDecimal("4.33")),
    BIWEEKLY(14, 3, new BigDecimal("2.17")),
    SEMIMONTHLY(15, 3, new BigDecimal("2")),
    MONTHLY(30, 4, BigDecimal.ONE),
    IRREGULAR(0, 0, BigDecimal.ZERO);

    private final int nominalDays;
    private final int toleranceDays;
    private final BigDecimal monthlyFactor;

    Cadence(int nominalDays, int toleranceDays, BigDecimal monthlyFactor) {
        this.nominalDays = nominalDays;
        this.toleranceDays = toleranceDays;
        this.monthlyFactor = monthlyFactor;
    }

    public int getNominalDays() {
        return nominalDays;
    }

    public int getToleranceDays() {
        return toleranceDays;
    }

    public BigDecimal getMonthlyFactor() {
        return monthlyFactor;
    }

    public boolean accepts(long gapDays) {
        return this != IRREGULAR && Math.abs(gapDays - nominalDays) <= toleranceDays;
    }
}
