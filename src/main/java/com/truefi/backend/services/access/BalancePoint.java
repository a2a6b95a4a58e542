package com.truefi.backend.services.access;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BalancePoint(LocalDate date, BigDecimal balance) {
}
