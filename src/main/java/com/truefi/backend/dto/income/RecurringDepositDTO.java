package com.truefi.backend.dto.income;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.truefi.backend.enums.Cadence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Summary of one qualifying recurring deposit series. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringDepositDTO {

    private String name;
    private BigDecimal amount;
    private BigDecimal monthlyAmount;
    private Cadence frequency;
    private int occurrences;
    private int confidence;
    private LocalDate firstDate;
    private LocalDate lastDate;
}
