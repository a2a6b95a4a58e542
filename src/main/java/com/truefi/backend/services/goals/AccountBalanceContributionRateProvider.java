package com.truefi.backend.services.goals;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.GoalTrackingProperties;
import com.truefi.backend.entities.Goal;
import com.truefi.backend.entities.RecurringIncome;
import com.truefi.backend.enums.GoalFundingSource;
import com.truefi.backend.services.access.BalancePoint;
import com.truefi.backend.services.access.FinancialDataAccess;
import com.truefi.backend.services.access.LinkedAccountBalance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Account-funded goals: balance growth of the linked accounts over the lookback window,
 * weighted by allocation and scaled to 30 days. Income-funded goals: the allocated share of
 * the active income. Manual goals have no observable rate.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class AccountBalanceContributionRateProvider implements ContributionRateProvider {

    private static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final FinancialDataAccess dataAccess;
    private final GoalTrackingProperties props;

    @Override
    public Optional<BigDecimal> observedMonthlyContribution(Goal goal, LocalDate today) {
        GoalFundingSource source = goal.getFundingSource() != null ? goal.getFundingSource() : GoalFundingSource.ACCOUNTS;
        return switch (source) {
            case ACCOUNTS -> fromAccountBalances(goal, today);
            case PRIMARY_INCOME -> fromIncomeAllocation(goal);
            case MANUAL -> Optional.empty();
        };
    }

    private Optional<BigDecimal> fromAccountBalances(Goal goal, LocalDate today) {
        List<LinkedAccountBalance> links = dataAccess.fetchLinkedAccountBalances(goal.getId());
        if (links.isEmpty()) {
            return Optional.empty();
        }
        LocalDate from = today.minusDays(props.contributionLookbackDays());

        BigDecimal total = BigDecimal.ZERO;
        boolean anyHistory = false;
        for (LinkedAccountBalance link : links) {
            List<BalancePoint> history = dataAccess.fetchBalanceHistory(link.accountId(), from);
            if (history.size() < 2) {
                continue;
            }
            BalancePoint first = history.get(0);
            BalancePoint last = history.get(history.size() - 1);
            long days = ChronoUnit.DAYS.between(first.date(), last.date());
            if (days <= 0) {
                continue;
            }
            BigDecimal fraction = link.allocationFraction() != null ? link.allocationFraction() : BigDecimal.ONE;
            BigDecimal monthly = last.balance().subtract(first.balance())
                    .multiply(fraction)
                    .multiply(DAYS_PER_MONTH)
                    .divide(BigDecimal.valueOf(days), 2, RoundingMode.HALF_UP);
            total = total.add(monthly);
            anyHistory = true;
        }
        if (!anyHistory) {
            log.debug("No balance history for goal {} in the last {} days", goal.getId(), props.contributionLookbackDays());
            return Optional.empty();
        }
        return Optional.of(total);
    }

    private Optional<BigDecimal> fromIncomeAllocation(Goal goal) {
        BigDecimal percent = goal.getIncomeAllocationPercent();
        if (percent == null || percent.signum() <= 0) {
            return Optional.empty();
        }
        List<RecurringIncome> active = dataAccess.fetchActiveIncomeRecords(goal.getUserId());
        if (active.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal income = active.stream()
                .map(RecurringIncome::monthlyAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Optional.of(income.multiply(percent).divide(HUNDRED, 2, RoundingMode.HALF_UP));
    }
}
