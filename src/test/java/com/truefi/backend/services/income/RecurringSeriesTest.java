package com.truefi.backend.services.income;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.truefi.backend.entities.Transaction;
import com.truefi.backend.enums.Cadence;

class RecurringSeriesTest {

    private final CadenceClassifier classifier = new CadenceClassifier();

    @Test
    void singleDeposit_isNotASeries() {
        List<Transaction> one = List.of(tx(LocalDate.of(2026, 1, 30), "2500.00"));

        assertThrows(IllegalArgumentException.class, () -> RecurringSeries.of(one, classifier));
    }

    @Test
    void members_areOrderedByDate_withIntervalsAndMedian() {
        RecurringSeries series = RecurringSeries.of(List.of(
                tx(LocalDate.of(2026, 3, 31), "2600.00"),
                tx(LocalDate.of(2026, 1, 30), "2500.00"),
                tx(LocalDate.of(2026, 2, 27), "2400.00")), classifier);

        assertEquals(LocalDate.of(2026, 1, 30), series.firstDate());
        assertEquals(LocalDate.of(2026, 3, 31), series.lastDate());
        assertEquals(List.of(28, 32), series.intervalsDays());
        assertEquals(0, new BigDecimal("2500.00").compareTo(series.representativeAmount()));
        assertEquals(Cadence.MONTHLY, series.cadence());
    }

    private static Transaction tx(LocalDate date, String amount) {
        return Transaction.builder()
                .id(UUID.randomUUID())
                .amount(new BigDecimal(amount))
                .postedDate(date)
                .rawDescription("INITECH PAYROLL")
                .currency("USD")
                .build();
    }
}
