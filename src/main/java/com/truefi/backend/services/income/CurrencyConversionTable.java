package com.truefi.backend.services.income;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.truefi.backend.exceptions.InvalidInputException;

/**
 * Fixed rates into a base currency, supplied by the caller for the duration of one detection.
 * {@code ratesToBase.get("EUR")} is the base amount of one EUR.
 */
public record CurrencyConversionTable(String baseCurrency, Map<String, BigDecimal> ratesToBase) {

    public CurrencyConversionTable {
        Objects.requireNonNull(baseCurrency, "baseCurrency");
        baseCurrency = baseCurrency.toUpperCase(Locale.ROOT);
        Map<String, BigDecimal> normalized = new HashMap<>();
        if (ratesToBase != null) {
            ratesToBase.forEach((k, v) -> normalized.put(k.toUpperCase(Locale.ROOT), v));
        }
        ratesToBase = Map.copyOf(normalized);
    }

    public BigDecimal toBase(BigDecimal amount, String currency) {
        String code = currency == null ? null : currency.toUpperCase(Locale.ROOT);
        if (baseCurrency.equals(code)) {
            return amount;
        }
        BigDecimal rate = code == null ? null : ratesToBase.get(code);
        if (rate == null || rate.signum() <= 0) {
            throw new InvalidInputException("No conversion rate from " + currency + " to " + baseCurrency);
        }
        return amount.multiply(rate).setScale(2, RoundingMode.HALF_UP);
    }
}
