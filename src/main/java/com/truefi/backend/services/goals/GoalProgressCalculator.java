package com.truefi.backend.services.goals;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.GoalTrackingProperties;
import com.truefi.backend.dto.goals.GoalProgressDTO;
import com.truefi.backend.entities.Goal;
import com.truefi.backend.services.stats.SeriesStats;

import lombok.RequiredArgsConstructor;

/**
 * Progress, pace and projected completion of a single goal. Months are 30 days throughout.
 * Pure: the caller passes today and the observed contribution rate.
 */
@RequiredArgsConstructor
@Component
public class GoalProgressCalculator {

    static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);
    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    // projections further out than this are omitted
    static final BigDecimal MAX_PROJECTION_DAYS = BigDecimal.valueOf(100L * 366);

    private final GoalTrackingProperties props;

    /**
     * @param observedMonthlyRate recent monthly contribution, null when unknown
     */
    public GoalProgressDTO calculate(Goal goal, BigDecimal observedMonthlyRate, LocalDate today) {
        BigDecimal target = nz(goal.getTargetAmount());
        BigDecimal current = nz(goal.getCurrentAmount());
        BigDecimal observed = observedMonthlyRate == null ? null : observedMonthlyRate.setScale(2, RoundingMode.HALF_UP);

        GoalProgressDTO.GoalProgressDTOBuilder builder = GoalProgressDTO.builder()
                .goalId(goal.getId() != null ? goal.getId().toString() : null)
                .name(goal.getName())
                .targetAmount(target)
                .currentAmount(current)
                .targetDate(goal.getTargetDate())
                .observedMonthlyContribution(observed);

        if (target.signum() <= 0) {
            return builder
                    .progressPercentage(BigDecimal.ZERO.setScale(2))
                    .validTarget(false)
                    .onTrack(false)
                    .build();
        }

        BigDecimal percentage = SeriesStats.clampMin(
                current.multiply(HUNDRED).divide(target, 2, RoundingMode.HALF_UP),
                BigDecimal.ZERO.setScale(2));
        BigDecimal remaining = SeriesStats.clampMin(target.subtract(current), BigDecimal.ZERO);

        BigDecimal required = null;
        if (goal.getTargetDate() != null) {
            // floor of one day, so a goal due today or earlier still gets a finite requirement
            long days = Math.max(1, ChronoUnit.DAYS.between(today, goal.getTargetDate()));
            required = remaining.multiply(DAYS_PER_MONTH)
                    .divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP);
        }

        boolean onTrack;
        if (remaining.signum() == 0 || required == null) {
            onTrack = true;
        } else {
            onTrack = observed != null
                    && observed.compareTo(required.multiply(props.onTrackTolerance())) >= 0;
        }

        return builder
                .progressPercentage(percentage)
                .validTarget(true)
                .onTrack(onTrack)
                .requiredMonthlyContribution(required)
                .projectedCompletionDate(projectCompletion(remaining, observed, today))
                .build();
    }

    private static LocalDate projectCompletion(BigDecimal remaining, BigDecimal observed, LocalDate today) {
        if (remaining.signum() == 0) {
            return today;
        }
        if (observed == null || observed.signum() <= 0) {
            return null;
        }
        BigDecimal days = remaining.multiply(DAYS_PER_MONTH).divide(observed, 0, RoundingMode.CEILING);
        if (days.compareTo(MAX_PROJECTION_DAYS) > 0) {
            return null;
        }
        return today.plusDays(days.longValue());
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
