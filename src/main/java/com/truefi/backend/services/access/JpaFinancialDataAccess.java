package com.truefi.backend.services.access;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.truefi.backend.entities.Goal;
import com.truefi.backend.entities.RecurringIncome;
import com.truefi.backend.entities.Transaction;
import com.truefi.backend.entities.UserSyncLock;
import com.truefi.backend.enums.IncomeRecordState;
import com.truefi.backend.exceptions.GoalNotFoundException;
import com.truefi.backend.exceptions.PersistenceConflictException;
import com.truefi.backend.repositories.AccountBalanceSnapshotRepository;
import com.truefi.backend.repositories.GoalAccountLinkRepository;
import com.truefi.backend.repositories.GoalRepository;
import com.truefi.backend.repositories.RecurringIncomeRepository;
import com.truefi.backend.repositories.TransactionRepository;
import com.truefi.backend.repositories.UserSyncLockRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * JPA-backed data access. Per-user serialization uses a row in {@code user_sync_locks} read with
 * {@code SELECT ... FOR UPDATE}; the row is created on first use.
 */
@Slf4j
@Repository
public class JpaFinancialDataAccess implements FinancialDataAccess {

    private static final Comparator<Goal> GOAL_ORDER = Comparator
            .comparing((Goal g) -> g.getPriority().ordinal())
            .thenComparing(Goal::getTargetDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Goal::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Goal::getName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TransactionRepository transactionRepository;
    private final RecurringIncomeRepository recurringIncomeRepository;
    private final GoalRepository goalRepository;
    private final GoalAccountLinkRepository goalAccountLinkRepository;
    private final AccountBalanceSnapshotRepository snapshotRepository;
    private final UserSyncLockRepository userSyncLockRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaFinancialDataAccess(
            TransactionRepository transactionRepository,
            RecurringIncomeRepository recurringIncomeRepository,
            GoalRepository goalRepository,
            GoalAccountLinkRepository goalAccountLinkRepository,
            AccountBalanceSnapshotRepository snapshotRepository,
            UserSyncLockRepository userSyncLockRepository,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.recurringIncomeRepository = recurringIncomeRepository;
        this.goalRepository = goalRepository;
        this.goalAccountLinkRepository = goalAccountLinkRepository;
        this.snapshotRepository = snapshotRepository;
        this.userSyncLockRepository = userSyncLockRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transaction> fetchTransactions(UUID userId, LocalDate from, LocalDate to) {
        if (from == null && to == null) {
            return transactionRepository.findByUserId(userId);
        }
        LocalDate start = from != null ? from : LocalDate.of(1970, 1, 1);
        LocalDate end = to != null ? to : LocalDate.now(clock);
        return transactionRepository.findByUserIdAndPostedDateBetween(userId, start, end);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecurringIncome> fetchActiveIncomeRecords(UUID userId) {
        return recurringIncomeRepository.findActive(userId, clock.instant());
    }

    @Override
    @Transactional(readOnly = true)
    public List<RecurringIncome> fetchIncomeHistory(UUID userId) {
        return recurringIncomeRepository.findByUserIdOrderByEffectiveFromDesc(userId);
    }

    @Override
    @Transactional
    public RecurringIncome supersedeAndCreateIncomeRecord(UUID userId, RecurringIncome newRecord) {
        Instant at = newRecord.getEffectiveFrom() != null ? newRecord.getEffectiveFrom() : clock.instant();
        try {
            List<RecurringIncome> active = recurringIncomeRepository.findActiveForUpdate(userId, at);
            for (RecurringIncome previous : active) {
                previous.supersede(at);
            }
            if (!active.isEmpty()) {
                recurringIncomeRepository.saveAllAndFlush(active);
                log.info("Superseded {} income record(s) for user {}", active.size(), userId);
            }

            newRecord.setUserId(userId);
            newRecord.setState(IncomeRecordState.CONFIRMED);
            newRecord.setEffectiveFrom(at);
            newRecord.setEffectiveTo(null);
            return recurringIncomeRepository.saveAndFlush(newRecord);
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            throw new PersistenceConflictException(userId, "Concurrent income update for user " + userId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Goal> fetchGoal(UUID goalId) {
        return goalRepository.findById(goalId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Goal> fetchGoalsForUser(UUID userId) {
        return goalRepository.findByUserIdAndActiveTrue(userId).stream()
                .sorted(GOAL_ORDER)
                .toList();
    }

    @Override
    @Transactional
    public Goal updateGoalCurrentAmount(UUID goalId, BigDecimal amount) {
        Goal goal = goalRepository.findById(goalId).orElseThrow(() -> new GoalNotFoundException(goalId));
        goal.setCurrentAmount(amount);
        return goalRepository.save(goal);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LinkedAccountBalance> fetchLinkedAccountBalances(UUID goalId) {
        return goalAccountLinkRepository.findActiveByGoalId(goalId).stream()
                .map(link -> new LinkedAccountBalance(
                        link.getAccount().getId(),
                        link.getAccount().getName(),
                        link.getAccount().getBalance(),
                        link.getAccount().getCurrency(),
                        link.getAllocationFraction()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<BalancePoint> fetchBalanceHistory(UUID accountId, LocalDate from) {
        return snapshotRepository.findByAccountIdAndCapturedOnGreaterThanEqualOrderByCapturedOnAsc(accountId, from)
                .stream()
                .map(s -> new BalancePoint(s.getCapturedOn(), s.getBalance()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public NotifiedState fetchLastNotifiedState(UUID goalId) {
        Goal goal = goalRepository.findById(goalId).orElseThrow(() -> new GoalNotFoundException(goalId));
        return new NotifiedState(goal.getLastNotifiedPercentage(), goal.getLastNotifiedOnTrack(),
                goal.isCompletionNotified());
    }

    @Override
    @Transactional
    public void recordNotifiedState(UUID goalId, NotifiedState state) {
        Goal goal = goalRepository.findById(goalId).orElseThrow(() -> new GoalNotFoundException(goalId));
        goal.setLastNotifiedPercentage(state.lastPercentage());
        goal.setLastNotifiedOnTrack(state.lastOnTrack());
        goal.setCompletionNotified(state.completionNotified());
        goalRepository.save(goal);
    }

    @Override
    public <T> T inUserTransaction(UUID userId, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                acquireUserLock(userId);
                return work.get();
            });
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            log.warn("Write conflict for user {}: {}", userId, e.getMessage());
            throw new PersistenceConflictException(userId, "Concurrent update for user " + userId, e);
        }
    }

    private void acquireUserLock(UUID userId) {
        if (userSyncLockRepository.findForUpdate(userId).isPresent()) {
            return;
        }
        // first write for this user; a racing insert fails on the primary key
        userSyncLockRepository.saveAndFlush(new UserSyncLock(userId, clock.instant()));
    }
}
