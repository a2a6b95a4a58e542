package com.truefi.backend.services.access;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.truefi.backend.entities.Goal;
import com.truefi.backend.entities.RecurringIncome;
import com.truefi.backend.entities.Transaction;
import com.truefi.backend.exceptions.GoalNotFoundException;
import com.truefi.backend.exceptions.PersistenceConflictException;

/**
 * Every read and write the income and goal services perform. The services never touch
 * repositories directly, which keeps them testable against an in-memory implementation.
 */
public interface FinancialDataAccess {

    /** Transactions posted in {@code [from, to]}; a null bound is open. */
    List<Transaction> fetchTransactions(UUID userId, LocalDate from, LocalDate to);

    /** Confirmed income records whose effective window contains the current instant, newest first. */
    List<RecurringIncome> fetchActiveIncomeRecords(UUID userId);

    /** All income records of the user, superseded ones included, newest first. */
    List<RecurringIncome> fetchIncomeHistory(UUID userId);

    /**
     * Closes every active record of the user at the new record's {@code effectiveFrom} and
     * stores {@code newRecord}. After this call exactly one record is active.
     *
     * @throws PersistenceConflictException when a concurrent writer won the race
     */
    RecurringIncome supersedeAndCreateIncomeRecord(UUID userId, RecurringIncome newRecord);

    Optional<Goal> fetchGoal(UUID goalId);

    /** Active goals ordered by priority, then target date (undated last), then creation time. */
    List<Goal> fetchGoalsForUser(UUID userId);

    /** @throws GoalNotFoundException if the goal does not exist */
    Goal updateGoalCurrentAmount(UUID goalId, BigDecimal amount);

    List<LinkedAccountBalance> fetchLinkedAccountBalances(UUID goalId);

    /** Daily balances of an account since {@code from}, oldest first. */
    List<BalancePoint> fetchBalanceHistory(UUID accountId, LocalDate from);

    /** @throws GoalNotFoundException if the goal does not exist */
    NotifiedState fetchLastNotifiedState(UUID goalId);

    /** @throws GoalNotFoundException if the goal does not exist */
    void recordNotifiedState(UUID goalId, NotifiedState state);

    /**
     * Runs {@code work} in one transaction holding the user's exclusive lock, so that
     * read-decide-write sequences for the same user never interleave.
     *
     * @throws PersistenceConflictException when the transaction lost a write race
     */
    <T> T inUserTransaction(UUID userId, Supplier<T> work);
}
