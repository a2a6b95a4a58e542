package com.truefi.backend.dto.income;

import java.math.BigDecimal;

import com.truefi.backend.enums.Cadence;
import com.truefi.backend.enums.IncomeBasis;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConfirmIncomeRequestDTO {

    @NotNull(message = "monthlyAmount is required")
    @DecimalMin(value = "0.01", message = "monthlyAmount must be positive")
    private BigDecimal monthlyAmount;

    // optional: defaults to MONTHLY
    private Cadence frequency;

    // optional: defaults to "manual"
    private String source;

    // optional: defaults to NET, deposits are take-home pay
    private IncomeBasis basis;

    private Integer confidence;
}
