package com.truefi.backend.services.income;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.truefi.backend.config.IncomeDetectionProperties;
import com.truefi.backend.dto.income.IncomeDetectionResult;
import com.truefi.backend.dto.income.RecurringDepositDTO;
import com.truefi.backend.entities.Transaction;
import com.truefi.backend.enums.Cadence;
import com.truefi.backend.exceptions.InvalidInputException;

class IncomeDetectorTest {

    private static final UUID USER = UUID.randomUUID();
    private static final UUID ACCOUNT = UUID.randomUUID();
    private static final LocalDate START = LocalDate.of(2026, 1, 2);

    private final IncomeDetector detector = newDetector(IncomeDetectionProperties.defaults());

    @Test
    void noInflows_returnsNoSignal() {
        List<Transaction> txs = List.of(
                tx(START, "-54.20", "WHOLE FOODS", "Groceries"),
                tx(START.plusDays(3), "-1200.00", "RENT", "Housing"));

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(0, result.getMonthlyIncome().compareTo(BigDecimal.ZERO));
        assertEquals(0, result.getConfidence());
        assertEquals(IncomeDetectionResult.SOURCE_TRANSACTIONS, result.getSource());
        assertTrue(result.getDetails().getRecurringDeposits().isEmpty());
    }

    @Test
    void emptyInput_returnsNoSignal() {
        IncomeDetectionResult result = detector.detectMonthlyIncome(List.of());

        assertFalse(result.hasSignal());
        assertEquals(0, result.getConfidence());
    }

    @Test
    @DisplayName("Six identical monthly paychecks: 3000/month with high confidence")
    void monthlyPayroll_isDetectedWithHighConfidence() {
        List<Transaction> txs = series(START, 30, 6, "3000.00", "ACME CORP PAYROLL");

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(new BigDecimal("3000.00"), result.getMonthlyIncome());
        assertTrue(result.getConfidence() >= 80, "confidence " + result.getConfidence());
        RecurringDepositDTO top = result.getDetails().getRecurringDeposits().get(0);
        assertEquals(Cadence.MONTHLY, top.getFrequency());
        assertEquals(6, top.getOccurrences());
        assertEquals(START, top.getFirstDate());
    }

    @Test
    void jitterBeyondTolerance_neverBeatsExactSeries() {
        int exactConfidence = detector.detectMonthlyIncome(series(START, 30, 6, "3000.00", "ACME CORP PAYROLL"))
                .getConfidence();

        String[] amounts = {"3000.00", "3450.00", "2550.00", "3400.00", "2600.00", "3000.00"};
        List<Transaction> txs = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            txs.add(tx(START.plusDays(30L * i), amounts[i], "ACME CORP PAYROLL", "Payroll"));
        }

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertTrue(result.getConfidence() <= exactConfidence);
    }

    @Test
    void smallVariation_withinTolerance_staysOneSeries() {
        String[] amounts = {"3000.00", "3050.00", "2980.00", "3010.00", "2995.00", "3020.00"};
        List<Transaction> txs = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            txs.add(tx(START.plusDays(30L * i), amounts[i], "ACME CORP PAYROLL", "Payroll"));
        }

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(1, result.getDetails().getRecurringDeposits().size());
        assertEquals(new BigDecimal("3005.00"), result.getMonthlyIncome());
    }

    @Test
    void biweeklyPaychecks_areNormalizedToMonthly() {
        List<Transaction> txs = series(LocalDate.of(2026, 1, 9), 14, 7, "1500.00", "GLOBEX PAYROLL");

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(Cadence.BIWEEKLY, result.getDetails().getRecurringDeposits().get(0).getFrequency());
        assertEquals(new BigDecimal("3255.00"), result.getMonthlyIncome());
    }

    @Test
    void threeBiweeklyPaychecks_startingOnTheSecond_useBiweeklyFactor() {
        List<Transaction> txs = series(LocalDate.of(2026, 1, 2), 14, 3, "1500.00", "GLOBEX PAYROLL");

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(Cadence.BIWEEKLY, result.getDetails().getRecurringDeposits().get(0).getFrequency());
        assertEquals(new BigDecimal("3255.00"), result.getMonthlyIncome());
    }

    @Test
    void semimonthlyPaychecks_areNormalizedToMonthly() {
        List<Transaction> txs = List.of(
                tx(LocalDate.of(2026, 1, 1), "2000.00", "INITECH SALARY", "Payroll"),
                tx(LocalDate.of(2026, 1, 15), "2000.00", "INITECH SALARY", "Payroll"),
                tx(LocalDate.of(2026, 2, 1), "2000.00", "INITECH SALARY", "Payroll"),
                tx(LocalDate.of(2026, 2, 13), "2000.00", "INITECH SALARY", "Payroll"),
                tx(LocalDate.of(2026, 3, 1), "2000.00", "INITECH SALARY", "Payroll"),
                tx(LocalDate.of(2026, 3, 15), "2000.00", "INITECH SALARY", "Payroll"));

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(Cadence.SEMIMONTHLY, result.getDetails().getRecurringDeposits().get(0).getFrequency());
        assertEquals(new BigDecimal("4000.00"), result.getMonthlyIncome());
    }

    @Test
    void weeklyPayouts_areNormalizedToMonthly() {
        List<Transaction> txs = series(LocalDate.of(2026, 3, 6), 7, 8, "500.00", "RIDESHARE EARNINGS");

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(new BigDecimal("2165.00"), result.getMonthlyIncome());
    }

    @Test
    @DisplayName("The top series is reported, series are not summed")
    void severalStreams_reportsHighestMonthlyOnly() {
        List<Transaction> txs = new ArrayList<>(series(START, 30, 6, "3000.00", "ACME CORP PAYROLL"));
        txs.addAll(series(START.plusDays(10), 30, 6, "800.00", "FREELANCE CLIENT LLC", "Income"));

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(new BigDecimal("3000.00"), result.getMonthlyIncome());
        List<RecurringDepositDTO> deposits = result.getDetails().getRecurringDeposits();
        assertEquals(2, deposits.size());
        assertEquals(new BigDecimal("800.00"), deposits.get(1).getMonthlyAmount());
    }

    @Test
    void internalTransfers_areNotIncome() {
        List<Transaction> txs = series(START, 30, 6, "3000.00", "ONLINE TRANSFER FROM SAVINGS", "Internal Transfer");

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertFalse(result.hasSignal());
    }

    @Test
    void pendingDeposits_areIgnored() {
        List<Transaction> txs = series(START, 30, 4, "3000.00", "ACME CORP PAYROLL");
        txs.forEach(t -> t.setPending(true));

        assertFalse(detector.detectMonthlyIncome(txs).hasSignal());
    }

    @Test
    void twoDeposits_stayBelowAutoConfirmation() {
        IncomeDetectionResult result = detector.detectMonthlyIncome(series(START, 30, 2, "3000.00", "ACME CORP PAYROLL"));

        assertEquals(new BigDecimal("3000.00"), result.getMonthlyIncome());
        assertTrue(result.getConfidence() >= IncomeDetectionProperties.defaults().minimumConfidence());
        assertTrue(result.getConfidence() < IncomeDetectionProperties.defaults().autoPersistConfidence());
    }

    @Test
    void duplicatePostingsOnSameDay_areCollapsed() {
        List<Transaction> txs = new ArrayList<>(series(START, 30, 4, "3000.00", "ACME CORP PAYROLL"));
        txs.add(tx(START.plusDays(30), "3000.00", "ACME CORP PAYROLL", "Payroll"));

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs);

        assertEquals(4, result.getDetails().getRecurringDeposits().get(0).getOccurrences());
        assertEquals(new BigDecimal("3000.00"), result.getMonthlyIncome());
    }

    @Test
    void irregularDeposits_areNotIncome() {
        List<Transaction> txs = List.of(
                tx(START, "3000.00", "ACME CORP PAYROLL", "Payroll"),
                tx(START.plusDays(9), "3000.00", "ACME CORP PAYROLL", "Payroll"),
                tx(START.plusDays(61), "3000.00", "ACME CORP PAYROLL", "Payroll"));

        assertFalse(detector.detectMonthlyIncome(txs).hasSignal());
    }

    @Test
    void mixedCurrencies_withoutConversionTable_fail() {
        List<Transaction> txs = new ArrayList<>(series(START, 30, 3, "3000.00", "ACME CORP PAYROLL"));
        Transaction euro = tx(START.plusDays(5), "900.00", "ACME GMBH PAYROLL", "Payroll");
        euro.setCurrency("EUR");
        txs.add(euro);

        assertThrows(InvalidInputException.class, () -> detector.detectMonthlyIncome(txs));
    }

    @Test
    void conversionTable_convertsToBaseCurrency() {
        List<Transaction> txs = series(START, 30, 4, "1000.00", "ACME GMBH PAYROLL");
        txs.forEach(t -> t.setCurrency("EUR"));
        CurrencyConversionTable table = new CurrencyConversionTable("USD", Map.of("EUR", new BigDecimal("1.10")));

        IncomeDetectionResult result = detector.detectMonthlyIncome(txs, table);

        assertEquals(new BigDecimal("1100.00"), result.getMonthlyIncome());
    }

    @Test
    void conversionTable_missingRate_fails() {
        List<Transaction> txs = series(START, 30, 3, "1000.00", "ACME GMBH PAYROLL");
        txs.forEach(t -> t.setCurrency("GBP"));
        CurrencyConversionTable table = new CurrencyConversionTable("USD", Map.of("EUR", new BigDecimal("1.10")));

        assertThrows(InvalidInputException.class, () -> detector.detectMonthlyIncome(txs, table));
    }

    @Test
    void missingAmount_fails() {
        Transaction broken = tx(START, "3000.00", "ACME CORP PAYROLL", "Payroll");
        broken.setAmount(null);

        assertThrows(InvalidInputException.class, () -> detector.detectMonthlyIncome(List.of(broken)));
    }

    @Test
    void sameInput_sameResult() {
        List<Transaction> txs = new ArrayList<>(series(START, 30, 5, "3000.00", "ACME CORP PAYROLL"));
        txs.addAll(series(START.plusDays(3), 14, 10, "700.00", "GLOBEX PAYROLL"));

        IncomeDetectionResult first = detector.detectMonthlyIncome(txs);
        IncomeDetectionResult second = detector.detectMonthlyIncome(new ArrayList<>(txs));

        assertEquals(first, second);
    }

    static IncomeDetector newDetector(IncomeDetectionProperties props) {
        return new IncomeDetector(
                props,
                new KeywordIncomeCandidatePredicate(props),
                new NormalizedDescriptionSimilarity(),
                new CadenceClassifier(),
                new SeriesConfidenceScorer(props));
    }

    private static List<Transaction> series(LocalDate start, int stepDays, int count, String amount, String description) {
        return series(start, stepDays, count, amount, description, "Payroll");
    }

    private static List<Transaction> series(LocalDate start, int stepDays, int count, String amount,
                                            String description, String category) {
        List<Transaction> txs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            txs.add(tx(start.plusDays((long) i * stepDays), amount, description, category));
        }
        return txs;
    }

    private static Transaction tx(LocalDate date, String amount, String description, String category) {
        return Transaction.builder()
                .id(UUID.randomUUID())
                .userId(USER)
                .accountId(ACCOUNT)
                .amount(new BigDecimal(amount))
                .postedDate(date)
                .rawDescription(description)
                .category(category)
                .build();
    }
}
