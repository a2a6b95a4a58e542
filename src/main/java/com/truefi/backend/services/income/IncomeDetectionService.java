package com.truefi.backend.services.income;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.truefi.backend.config.IncomeDetectionProperties;
import com.truefi.backend.dto.income.ConfirmIncomeRequestDTO;
import com.truefi.backend.dto.income.IncomeDetectionOutcome;
import com.truefi.backend.dto.income.IncomeDetectionResult;
import com.truefi.backend.dto.income.IncomeSummaryDTO;
import com.truefi.backend.dto.income.RecurringDepositDTO;
import com.truefi.backend.dto.income.RecurringIncomeDTO;
import com.truefi.backend.entities.RecurringIncome;
import com.truefi.backend.enums.Cadence;
import com.truefi.backend.enums.IncomeBasis;
import com.truefi.backend.enums.IncomeRecordState;
import com.truefi.backend.exceptions.BadRequestException;
import com.truefi.backend.services.access.ConflictRetry;
import com.truefi.backend.services.access.FinancialDataAccess;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Income lifecycle around the pure {@link IncomeDetector}: skips users who already declared
 * income, auto-confirms confident detections and stores confirmations, superseding whatever
 * was active before.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class IncomeDetectionService {

    static final String MANUAL_SOURCE = "manual";

    private final FinancialDataAccess dataAccess;
    private final IncomeDetector incomeDetector;
    private final IncomeDetectionProperties props;
    private final Clock clock;

    public IncomeDetectionOutcome detectAndPersist(UUID userId) {
        List<RecurringIncome> active = dataAccess.fetchActiveIncomeRecords(userId);
        if (!active.isEmpty()) {
            log.debug("User {} already has {} active income record(s); detection skipped", userId, active.size());
            return IncomeDetectionOutcome.builder()
                    .state(IncomeRecordState.CONFIRMED)
                    .detected(false)
                    .requiresConfirmation(false)
                    .message("Income already confirmed")
                    .activeIncome(active.stream().map(IncomeDetectionService::toDto).toList())
                    .build();
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(props.lookbackDays());
        IncomeDetectionResult result = incomeDetector.detectMonthlyIncome(
                dataAccess.fetchTransactions(userId, from, today));

        IncomeRecordState state = IncomeRecordState.UNDETECTED;
        if (!result.hasSignal()) {
            log.info("No recurring income found for user {} in the last {} days", userId, props.lookbackDays());
            return IncomeDetectionOutcome.builder()
                    .state(state)
                    .detected(false)
                    .requiresConfirmation(false)
                    .message("No recurring income detected")
                    .result(result)
                    .activeIncome(List.of())
                    .build();
        }

        if (result.getConfidence() >= props.autoPersistConfidence()) {
            state = advance(state, IncomeRecordState.CONFIRMED);
            RecurringIncome stored = persistDetectedIncome(userId, result);
            log.info("Auto-confirmed income {} for user {} (confidence {})",
                    stored.getNetMonthly(), userId, result.getConfidence());
            return IncomeDetectionOutcome.builder()
                    .state(state)
                    .detected(true)
                    .requiresConfirmation(false)
                    .message("Income detected and saved")
                    .result(result)
                    .activeIncome(List.of(toDto(stored)))
                    .build();
        }

        state = advance(state, IncomeRecordState.PENDING_CONFIRMATION);
        log.info("Income {} detected for user {} with confidence {}; awaiting confirmation",
                result.getMonthlyIncome(), userId, result.getConfidence());
        return IncomeDetectionOutcome.builder()
                .state(state)
                .detected(true)
                .requiresConfirmation(true)
                .message("Income detected, please confirm")
                .result(result)
                .activeIncome(List.of())
                .build();
    }

    /**
     * Stores a detection as the user's active income. Detected deposits are take-home pay, so
     * the amount lands in {@code netMonthly}.
     */
    public RecurringIncome persistDetectedIncome(UUID userId, IncomeDetectionResult result) {
        if (result == null || !result.hasSignal()) {
            throw new BadRequestException("Detection result carries no income to persist");
        }
        RecurringDepositDTO top = topDeposit(result);
        Cadence frequency = top != null ? top.getFrequency() : Cadence.MONTHLY;
        LocalDate nextPayDate = top != null && top.getLastDate() != null
                ? top.getLastDate().plusDays(frequency.getNominalDays())
                : LocalDate.now(clock).plusDays(Cadence.MONTHLY.getNominalDays());

        return persistWithRetry(userId, () -> RecurringIncome.builder()
                .source(top != null ? top.getName() : result.getSource())
                .netMonthly(result.getMonthlyIncome())
                .frequency(frequency)
                .confidence(result.getConfidence())
                .nextPayDate(nextPayDate)
                .effectiveFrom(clock.instant())
                .build());
    }

    public RecurringIncomeDTO confirmIncome(UUID userId, ConfirmIncomeRequestDTO request) {
        BigDecimal amount = request.getMonthlyAmount();
        if (amount == null || amount.signum() <= 0) {
            throw new BadRequestException("monthlyAmount must be positive");
        }
        amount = amount.setScale(2, RoundingMode.HALF_UP);
        IncomeBasis basis = request.getBasis() != null ? request.getBasis() : IncomeBasis.NET;
        Cadence frequency = request.getFrequency() != null ? request.getFrequency() : Cadence.MONTHLY;
        String source = request.getSource() != null && !request.getSource().isBlank()
                ? request.getSource().trim()
                : MANUAL_SOURCE;
        BigDecimal gross = basis == IncomeBasis.GROSS ? amount : null;
        BigDecimal net = basis == IncomeBasis.NET ? amount : null;

        RecurringIncome stored = persistWithRetry(userId, () -> RecurringIncome.builder()
                .source(source)
                .grossMonthly(gross)
                .netMonthly(net)
                .frequency(frequency)
                .confidence(request.getConfidence())
                .effectiveFrom(clock.instant())
                .build());
        log.info("User {} confirmed {} income of {} from '{}'", userId, basis, amount, source);
        return toDto(stored);
    }

    public IncomeSummaryDTO getIncomeSummary(UUID userId) {
        List<RecurringIncomeDTO> history = dataAccess.fetchIncomeHistory(userId).stream()
                .map(IncomeDetectionService::toDto)
                .toList();
        List<RecurringIncome> active = dataAccess.fetchActiveIncomeRecords(userId);
        BigDecimal total = active.stream()
                .map(RecurringIncome::monthlyAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        return IncomeSummaryDTO.builder()
                .recurringIncome(history)
                .activeIncome(active.stream().map(IncomeDetectionService::toDto).toList())
                .totalMonthlyIncome(total)
                .hasIncome(!active.isEmpty())
                .build();
    }

    /**
     * Supersede-and-insert under the user lock. A lost race is retried once with a freshly built
     * record; the data access re-reads the active set inside the retry.
     */
    private RecurringIncome persistWithRetry(UUID userId, Supplier<RecurringIncome> recordFactory) {
        return ConflictRetry.withRetry("Income update", userId, () -> {
            RecurringIncome record = recordFactory.get();
            return dataAccess.inUserTransaction(userId,
                    () -> dataAccess.supersedeAndCreateIncomeRecord(userId, record));
        });
    }

    private static IncomeRecordState advance(IncomeRecordState from, IncomeRecordState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal income state transition " + from + " -> " + to);
        }
        return to;
    }

    private static RecurringDepositDTO topDeposit(IncomeDetectionResult result) {
        if (result.getDetails() == null || result.getDetails().getRecurringDeposits() == null
                || result.getDetails().getRecurringDeposits().isEmpty()) {
            return null;
        }
        return result.getDetails().getRecurringDeposits().get(0);
    }

    static RecurringIncomeDTO toDto(RecurringIncome income) {
        return RecurringIncomeDTO.builder()
                .id(income.getId() != null ? income.getId().toString() : null)
                .source(income.getSource())
                .grossMonthly(income.getGrossMonthly())
                .netMonthly(income.getNetMonthly())
                .frequency(income.getFrequency())
                .state(income.getState())
                .confidence(income.getConfidence())
                .nextPayDate(income.getNextPayDate())
                .effectiveFrom(income.getEffectiveFrom())
                .effectiveTo(income.getEffectiveTo())
                .build();
    }
}
