package com.truefi.backend.services.goals;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.GoalTrackingProperties;
import com.truefi.backend.dto.goals.GoalProgressDTO;
import com.truefi.backend.services.income.DescriptionNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * Plain-language advice for one goal, derived from its computed progress. Pure.
 */
@RequiredArgsConstructor
@Component
public class GoalRecommendationPolicy {

    static final BigDecimal EARLY_STAGE_PERCENT = BigDecimal.valueOf(25);
    static final BigDecimal HALFWAY_PERCENT = BigDecimal.valueOf(50);
    static final BigDecimal CLOSE_PERCENT = BigDecimal.valueOf(75);

    static final String INCREASE_CONTRIBUTION = "Consider increasing your monthly contribution to get back on track";
    static final String AUTOMATE_TRANSFERS = "Set up automatic transfers to ensure consistent progress";
    static final String START_SMALL = "Start with a small, achievable monthly contribution";
    static final String REVIEW_BUDGET = "Review your budget to find areas where you can save";
    static final String ALMOST_THERE = "You're close to your goal! Stay consistent";
    static final String NEXT_GOAL = "Consider what your next financial goal will be";
    static final String SET_TARGET = "Set a target amount above zero to track this goal";
    static final String EMERGENCY_FIRST = "Prioritize building your emergency fund before other goals";
    static final String DEBT_METHOD = "Consider the avalanche or snowball method for faster payoff";
    static final String EMPLOYER_MATCH = "Check if your employer offers matching contributions";

    private final GoalTrackingProperties props;

    public List<String> recommend(GoalProgressDTO progress) {
        if (!progress.isValidTarget()) {
            return List.of(SET_TARGET);
        }
        BigDecimal pct = progress.getProgressPercentage();
        BigDecimal rate = progress.getObservedMonthlyContribution();
        boolean contributing = rate != null && rate.signum() > 0;
        List<String> out = new ArrayList<>();

        if (!progress.isOnTrack()) {
            out.add(INCREASE_CONTRIBUTION);
            if (rate == null || rate.compareTo(props.lowContributionAmount()) < 0) {
                out.add(AUTOMATE_TRANSFERS);
            }
        }
        if (pct.compareTo(EARLY_STAGE_PERCENT) < 0 && !contributing) {
            out.add(START_SMALL);
            out.add(REVIEW_BUDGET);
        }
        if (progress.isCompleted()) {
            out.add(NEXT_GOAL);
        } else if (pct.compareTo(CLOSE_PERCENT) > 0) {
            out.add(ALMOST_THERE);
            out.add(NEXT_GOAL);
        }

        String name = DescriptionNormalizer.normalize(progress.getName());
        if (name.contains("emergency")) {
            if (pct.compareTo(HALFWAY_PERCENT) < 0) {
                out.add(EMERGENCY_FIRST);
            }
        } else if (name.contains("debt") || name.contains("loan")) {
            out.add(DEBT_METHOD);
        } else if (name.contains("retirement") || name.contains("401k")) {
            out.add(EMPLOYER_MATCH);
        }
        return out;
    }
}
