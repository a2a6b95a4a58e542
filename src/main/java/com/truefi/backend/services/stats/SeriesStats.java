package com.truefi.backend.services.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Small statistics helpers shared by income detection and goal tracking. */
public final class SeriesStats {

    private SeriesStats() {
    }

    public static BigDecimal median(List<BigDecimal> values) {
        List<BigDecimal> sorted = values == null ? List.of() : values.stream()
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        if (sorted.isEmpty()) {
            return BigDecimal.ZERO;
        }
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return sorted.get(mid - 1).add(sorted.get(mid))
                .divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_UP);
    }

    public static double mean(List<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        int n = 0;
        for (Number v : values) {
            if (v == null) {
                continue;
            }
            sum += v.doubleValue();
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }

    public static double stdDevSample(List<? extends Number> values, double mean) {
        if (values == null) {
            return 0.0;
        }
        List<? extends Number> cleaned = values.stream().filter(Objects::nonNull).toList();
        int n = cleaned.size();
        if (n < 2) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (Number v : cleaned) {
            double d = v.doubleValue() - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    /** Standard deviation over mean; 0 for fewer than two values or a zero mean. */
    public static double coefficientOfVariation(List<? extends Number> values) {
        double mean = mean(values);
        if (mean == 0.0) {
            return 0.0;
        }
        return stdDevSample(values, mean) / Math.abs(mean);
    }

    /** Day gaps between consecutive dates; the input must already be in ascending order. */
    public static List<Integer> gapsInDays(List<LocalDate> sortedDates) {
        if (sortedDates == null || sortedDates.size() < 2) {
            return List.of();
        }
        List<Integer> gaps = new ArrayList<>(sortedDates.size() - 1);
        for (int i = 1; i < sortedDates.size(); i++) {
            gaps.add((int) ChronoUnit.DAYS.between(sortedDates.get(i - 1), sortedDates.get(i)));
        }
        return gaps;
    }

    public static BigDecimal clampMin(BigDecimal value, BigDecimal floor) {
        return value.compareTo(floor) < 0 ? floor : value;
    }
}
