package com.truefi.backend.services.income;

import java.time.LocalDate;
import java.util.List;
import java.util.TreeSet;

import org.springframework.stereotype.Component;

import com.truefi.backend.enums.Cadence;
import com.truefi.backend.services.stats.SeriesStats;

/**
 * Maps the posting dates of one series to a pay cadence.
 *
 * <p>Bands are checked narrowest first. SEMIMONTHLY wins over BIWEEKLY only when the dates sit
 * on at most two day-of-month anchors (1st/15th, 15th/month end) and the gaps are not a fixed
 * fourteen days; a fixed fourteen-day rhythm is biweekly even when it starts near the 1st.
 * Series with five or more gaps may contain a single out-of-band gap, which covers a skipped or
 * doubled pay period.
 */
@Component
public class CadenceClassifier {

    static final int OUTLIER_GAP_THRESHOLD = 5;
    static final int ANCHOR_TOLERANCE_DAYS = 2;
    static final int MONTH_END_WINDOW_DAYS = 4;

    public Cadence classify(List<LocalDate> sortedDates) {
        List<Integer> gaps = SeriesStats.gapsInDays(sortedDates);
        if (gaps.isEmpty()) {
            return Cadence.IRREGULAR;
        }
        int allowedOutliers = gaps.size() >= OUTLIER_GAP_THRESHOLD ? 1 : 0;

        if (fits(gaps, Cadence.WEEKLY, allowedOutliers)) {
            return Cadence.WEEKLY;
        }
        if (sortedDates.size() >= 3
                && fits(gaps, Cadence.SEMIMONTHLY, allowedOutliers)
                && !everyGapIs(gaps, Cadence.BIWEEKLY.getNominalDays())
                && anchorCount(sortedDates) == 2) {
            return Cadence.SEMIMONTHLY;
        }
        if (fits(gaps, Cadence.BIWEEKLY, allowedOutliers)) {
            return Cadence.BIWEEKLY;
        }
        if (fits(gaps, Cadence.MONTHLY, allowedOutliers)) {
            return Cadence.MONTHLY;
        }
        return Cadence.IRREGULAR;
    }

    private static boolean fits(List<Integer> gaps, Cadence cadence, int allowedOutliers) {
        long misses = gaps.stream().filter(g -> !cadence.accepts(g)).count();
        return misses <= allowedOutliers && misses < gaps.size();
    }

    private static boolean everyGapIs(List<Integer> gaps, int days) {
        return gaps.stream().allMatch(g -> g == days);
    }

    /**
     * Number of distinct pay-day anchors. The last four days of a month count as month end,
     * which is also treated as adjacent to the first days of the next month.
     */
    static int anchorCount(List<LocalDate> dates) {
        TreeSet<Integer> days = new TreeSet<>();
        for (LocalDate d : dates) {
            days.add(d.getDayOfMonth() > d.lengthOfMonth() - MONTH_END_WINDOW_DAYS ? 0 : d.getDayOfMonth());
        }
        int anchors = 0;
        Integer previous = null;
        for (Integer day : days) {
            if (previous == null || day - previous > ANCHOR_TOLERANCE_DAYS) {
                anchors++;
            }
            previous = day;
        }
        return anchors;
    }
}
