package com.truefi.backend.dto.income;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import com.truefi.backend.enums.Cadence;
import com.truefi.backend.enums.IncomeRecordState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringIncomeDTO {

    private String id;
    private String source;
    private BigDecimal grossMonthly;
    private BigDecimal netMonthly;
    private Cadence frequency;
    private IncomeRecordState state;
    private Integer confidence;
    private LocalDate nextPayDate;
    private Instant effectiveFrom;
    private Instant effectiveTo;
}
