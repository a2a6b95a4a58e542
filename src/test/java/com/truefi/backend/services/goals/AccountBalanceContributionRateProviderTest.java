package com.truefi.backend.services.goals;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.truefi.backend.config.GoalTrackingProperties;
import com.truefi.backend.entities.Goal;
import com.truefi.backend.entities.RecurringIncome;
import com.truefi.backend.enums.Cadence;
import com.truefi.backend.enums.GoalFundingSource;
import com.truefi.backend.services.access.BalancePoint;
import com.truefi.backend.services.access.FinancialDataAccess;
import com.truefi.backend.services.access.LinkedAccountBalance;

@ExtendWith(MockitoExtension.class)
class AccountBalanceContributionRateProviderTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 6, 30);

    @Mock
    private FinancialDataAccess dataAccess;

    private AccountBalanceContributionRateProvider provider;

    @BeforeEach
    void setUp() {
        provider = new AccountBalanceContributionRateProvider(dataAccess, GoalTrackingProperties.defaults());
    }

    @Test
    void accountGoal_usesAllocatedBalanceGrowthPerThirtyDays() {
        Goal goal = goal(GoalFundingSource.ACCOUNTS);
        UUID accountId = UUID.randomUUID();
        when(dataAccess.fetchLinkedAccountBalances(goal.getId())).thenReturn(List.of(
                new LinkedAccountBalance(accountId, "Savings", new BigDecimal("4000"), "USD", new BigDecimal("0.5"))));
        when(dataAccess.fetchBalanceHistory(accountId, TODAY.minusDays(90))).thenReturn(List.of(
                new BalancePoint(LocalDate.of(2026, 4, 1), new BigDecimal("1000")),
                new BalancePoint(LocalDate.of(2026, 5, 15), new BigDecimal("2500")),
                new BalancePoint(LocalDate.of(2026, 6, 30), new BigDecimal("4000"))));

        Optional<BigDecimal> rate = provider.observedMonthlyContribution(goal, TODAY);

        // (4000 - 1000) * 0.5 over 90 days
        assertEquals(new BigDecimal("500.00"), rate.orElseThrow());
    }

    @Test
    void accountGoal_withoutHistory_isUnknown() {
        Goal goal = goal(GoalFundingSource.ACCOUNTS);
        UUID accountId = UUID.randomUUID();
        when(dataAccess.fetchLinkedAccountBalances(goal.getId())).thenReturn(List.of(
                new LinkedAccountBalance(accountId, "Savings", new BigDecimal("4000"), "USD", BigDecimal.ONE)));
        when(dataAccess.fetchBalanceHistory(accountId, TODAY.minusDays(90))).thenReturn(List.of(
                new BalancePoint(TODAY, new BigDecimal("4000"))));

        assertTrue(provider.observedMonthlyContribution(goal, TODAY).isEmpty());
    }

    @Test
    void incomeGoal_usesAllocatedShareOfActiveIncome() {
        Goal goal = goal(GoalFundingSource.PRIMARY_INCOME);
        goal.setIncomeAllocationPercent(new BigDecimal("10"));
        when(dataAccess.fetchActiveIncomeRecords(goal.getUserId())).thenReturn(List.of(
                RecurringIncome.builder()
                        .netMonthly(new BigDecimal("5000.00"))
                        .frequency(Cadence.MONTHLY)
                        .build()));

        assertEquals(new BigDecimal("500.00"), provider.observedMonthlyContribution(goal, TODAY).orElseThrow());
    }

    @Test
    void manualGoal_hasNoObservableRate() {
        assertTrue(provider.observedMonthlyContribution(goal(GoalFundingSource.MANUAL), TODAY).isEmpty());
        verifyNoInteractions(dataAccess);
    }

    private static Goal goal(GoalFundingSource source) {
        return Goal.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .name("House deposit")
                .targetAmount(new BigDecimal("20000"))
                .fundingSource(source)
                .build();
    }
}
