package com.truefi.backend.services.income;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.IncomeDetectionProperties;
import com.truefi.backend.services.stats.SeriesStats;

import lombok.RequiredArgsConstructor;

/**
 * Confidence, 0-100, that a series is a real income stream.
 *
 * <p>The base score saturates with occurrences: {@code 100 * (1 - e^(-n / 2.5))}, so two
 * deposits give 55 and six give 91. Irregular gaps and varying amounts subtract a capped
 * penalty each. A payroll-looking description adds a bonus once the series has three members.
 */
@RequiredArgsConstructor
@Component
public class SeriesConfidenceScorer {

    static final double OCCURRENCE_SCALE = 2.5;
    static final double GAP_PENALTY_WEIGHT = 100.0;
    static final double GAP_PENALTY_CAP = 40.0;
    static final double AMOUNT_PENALTY_WEIGHT = 200.0;
    static final double AMOUNT_PENALTY_CAP = 30.0;
    static final double PAYROLL_BONUS = 10.0;
    static final int PAYROLL_BONUS_MIN_OCCURRENCES = 3;

    private final IncomeDetectionProperties props;

    public int score(RecurringSeries series) {
        int n = series.size();
        double base = 100.0 * (1.0 - Math.exp(-n / OCCURRENCE_SCALE));

        double gapPenalty = Math.min(GAP_PENALTY_CAP,
                SeriesStats.coefficientOfVariation(series.intervalsDays()) * GAP_PENALTY_WEIGHT);

        List<BigDecimal> amounts = series.amounts();
        double amountPenalty = Math.min(AMOUNT_PENALTY_CAP,
                SeriesStats.coefficientOfVariation(amounts) * AMOUNT_PENALTY_WEIGHT);

        double bonus = n >= PAYROLL_BONUS_MIN_OCCURRENCES && looksLikePayroll(series) ? PAYROLL_BONUS : 0.0;

        long score = Math.round(base - gapPenalty - amountPenalty + bonus);
        return (int) Math.max(0, Math.min(100, score));
    }

    private boolean looksLikePayroll(RecurringSeries series) {
        String text = DescriptionNormalizer.normalize(series.name() + " " + series.sampleDescription());
        return DescriptionNormalizer.containsAny(text, props.payrollKeywords());
    }
}
