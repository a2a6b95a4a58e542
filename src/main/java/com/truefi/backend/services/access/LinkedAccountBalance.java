package com.truefi.backend.services.access;

import java.math.BigDecimal;
import java.util.UUID;

/** Current balance of an account funding a goal, with the share allocated to that goal. */
public record LinkedAccountBalance(
        UUID accountId,
        String accountName,
        BigDecimal balance,
        String currency,
        BigDecimal allocationFraction
) {
}
