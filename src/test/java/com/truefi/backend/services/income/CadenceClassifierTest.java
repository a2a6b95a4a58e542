package com.truefi.backend.services.income;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.truefi.backend.enums.Cadence;

class CadenceClassifierTest {

    private final CadenceClassifier classifier = new CadenceClassifier();

    @Test
    void everySevenDays_isWeekly() {
        assertEquals(Cadence.WEEKLY, classifier.classify(stepped(LocalDate.of(2026, 3, 6), 7, 6)));
    }

    @Test
    void everyFourteenDays_isBiweekly() {
        assertEquals(Cadence.BIWEEKLY, classifier.classify(stepped(LocalDate.of(2026, 1, 9), 14, 7)));
    }

    @Test
    void fixedFourteenDayGaps_startingNearMonthStart_areBiweekly() {
        // the 2nd and 30th fall on the same month-end/start anchor
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 2),
                LocalDate.of(2026, 1, 16),
                LocalDate.of(2026, 1, 30));

        assertEquals(2, CadenceClassifier.anchorCount(dates));
        assertEquals(Cadence.BIWEEKLY, classifier.classify(dates));
    }

    @Test
    void firstAndFifteenth_isSemimonthly() {
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 1),
                LocalDate.of(2026, 1, 15),
                LocalDate.of(2026, 2, 1),
                LocalDate.of(2026, 2, 13), // 15th was a Sunday
                LocalDate.of(2026, 3, 1),
                LocalDate.of(2026, 3, 15));

        assertEquals(Cadence.SEMIMONTHLY, classifier.classify(dates));
    }

    @Test
    @DisplayName("Fifteenth and last day of month counts as two anchors")
    void fifteenthAndMonthEnd_isSemimonthly() {
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 15),
                LocalDate.of(2026, 1, 30),
                LocalDate.of(2026, 2, 13),
                LocalDate.of(2026, 2, 27),
                LocalDate.of(2026, 3, 13),
                LocalDate.of(2026, 3, 31));

        assertEquals(Cadence.SEMIMONTHLY, classifier.classify(dates));
    }

    @Test
    void calendarMonthEnds_areMonthly() {
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 30),
                LocalDate.of(2026, 2, 27),
                LocalDate.of(2026, 3, 31),
                LocalDate.of(2026, 4, 30));

        assertEquals(Cadence.MONTHLY, classifier.classify(dates));
    }

    @Test
    void oneSkippedMonth_inLongSeries_isStillMonthly() {
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 1),
                LocalDate.of(2026, 1, 31),
                LocalDate.of(2026, 3, 2),
                LocalDate.of(2026, 5, 1), // April missing
                LocalDate.of(2026, 5, 31),
                LocalDate.of(2026, 6, 30));

        assertEquals(Cadence.MONTHLY, classifier.classify(dates));
    }

    @Test
    void outlierGap_inShortSeries_isIrregular() {
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 1),
                LocalDate.of(2026, 1, 31),
                LocalDate.of(2026, 4, 1));

        assertEquals(Cadence.IRREGULAR, classifier.classify(dates));
    }

    @Test
    void singleDate_isIrregular() {
        assertEquals(Cadence.IRREGULAR, classifier.classify(List.of(LocalDate.of(2026, 1, 1))));
    }

    @Test
    void anchorCount_mergesMonthEndWithFirstDays() {
        List<LocalDate> dates = List.of(
                LocalDate.of(2026, 1, 30),
                LocalDate.of(2026, 3, 2),
                LocalDate.of(2026, 4, 1));

        assertEquals(1, CadenceClassifier.anchorCount(dates));
    }

    private static List<LocalDate> stepped(LocalDate start, int stepDays, int count) {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            dates.add(start.plusDays((long) i * stepDays));
        }
        return dates;
    }
}
