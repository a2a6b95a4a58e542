package com.truefi.backend.services.goals;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.truefi.backend.config.GoalTrackingProperties;
import com.truefi.backend.dto.goals.GoalProgressDTO;
import com.truefi.backend.dto.goals.GoalProgressReportDTO;
import com.truefi.backend.dto.goals.GoalProgressSummaryDTO;
import com.truefi.backend.dto.goals.ProgressNotificationDTO;
import com.truefi.backend.entities.Goal;
import com.truefi.backend.exceptions.BadRequestException;
import com.truefi.backend.exceptions.GoalNotFoundException;
import com.truefi.backend.services.access.ConflictRetry;
import com.truefi.backend.services.access.FinancialDataAccess;
import com.truefi.backend.services.access.LinkedAccountBalance;
import com.truefi.backend.services.access.NotifiedState;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Goal progress tracking. Every evaluation runs inside the user's transaction so concurrent
 * passes for the same user cannot emit the same milestone twice. A pass that loses a write race
 * is run once more from a fresh read.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class GoalProgressService {

    private final FinancialDataAccess dataAccess;
    private final GoalProgressCalculator calculator;
    private final ProgressNotificationPolicy notificationPolicy;
    private final GoalRecommendationPolicy recommendationPolicy;
    private final ContributionRateProvider contributionRateProvider;
    private final ProgressNotificationSink notificationSink;
    private final GoalTrackingProperties props;
    private final Clock clock;

    /** @throws GoalNotFoundException if the goal is missing or owned by someone else */
    public GoalProgressDTO trackGoalProgress(UUID userId, UUID goalId) {
        return ConflictRetry.withRetry("Goal tracking", userId, () -> dataAccess.inUserTransaction(userId, () -> {
            Goal goal = requireOwnedGoal(userId, goalId);
            Evaluation evaluation = evaluate(goal, LocalDate.now(clock), clock.instant());
            notificationSink.publish(userId, evaluation.notifications());
            return evaluation.progress();
        }));
    }

    public List<GoalProgressDTO> trackAllGoalsProgress(UUID userId) {
        return runPass(userId).stream().map(Evaluation::progress).toList();
    }

    public List<ProgressNotificationDTO> generateProgressNotifications(UUID userId) {
        return runPass(userId).stream()
                .flatMap(e -> e.notifications().stream())
                .toList();
    }

    /** Progress of every goal plus the notifications this pass produced. */
    public GoalProgressReportDTO buildProgressReport(UUID userId) {
        List<Evaluation> evaluations = runPass(userId);
        List<GoalProgressDTO> progress = evaluations.stream().map(Evaluation::progress).toList();
        return GoalProgressReportDTO.builder()
                .progress(progress)
                .summary(summarize(progress))
                .notifications(evaluations.stream().flatMap(e -> e.notifications().stream()).toList())
                .build();
    }

    /**
     * Sets each account-linked goal's current amount to the allocated sum of its linked
     * balances. Differences within the sync epsilon are left alone.
     *
     * @return number of goals whose amount changed
     */
    public int updateGoalProgressFromAccounts(UUID userId) {
        int updated = ConflictRetry.withRetry("Account sync", userId, () -> dataAccess.inUserTransaction(userId, () -> {
            int changed = 0;
            for (Goal goal : dataAccess.fetchGoalsForUser(userId)) {
                List<LinkedAccountBalance> links = dataAccess.fetchLinkedAccountBalances(goal.getId());
                if (links.isEmpty()) {
                    continue;
                }
                BigDecimal linked = links.stream()
                        .map(l -> nz(l.balance()).multiply(l.allocationFraction() != null ? l.allocationFraction() : BigDecimal.ONE))
                        .reduce(BigDecimal.ZERO, BigDecimal::add)
                        .setScale(2, RoundingMode.HALF_UP);
                BigDecimal current = nz(goal.getCurrentAmount());
                if (linked.subtract(current).abs().compareTo(props.syncEpsilon()) > 0) {
                    dataAccess.updateGoalCurrentAmount(goal.getId(), linked);
                    log.debug("Goal {} synced from {} to {}", goal.getId(), current, linked);
                    changed++;
                }
            }
            return changed;
        }));
        log.info("Account sync updated {} goal(s) for user {}", updated, userId);
        return updated;
    }

    public GoalProgressDTO updateGoalCurrentAmount(UUID userId, UUID goalId, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new BadRequestException("amount must be zero or positive");
        }
        return ConflictRetry.withRetry("Goal update", userId, () -> dataAccess.inUserTransaction(userId, () -> {
            requireOwnedGoal(userId, goalId);
            Goal goal = dataAccess.updateGoalCurrentAmount(goalId, amount.setScale(2, RoundingMode.HALF_UP));
            Evaluation evaluation = evaluate(goal, LocalDate.now(clock), clock.instant());
            notificationSink.publish(userId, evaluation.notifications());
            return evaluation.progress();
        }));
    }

    public static GoalProgressSummaryDTO summarize(List<GoalProgressDTO> progress) {
        int onTrack = (int) progress.stream().filter(GoalProgressDTO::isOnTrack).count();
        int completed = (int) progress.stream().filter(GoalProgressDTO::isCompleted).count();
        BigDecimal average = progress.isEmpty()
                ? BigDecimal.ZERO.setScale(2)
                : progress.stream()
                        .map(GoalProgressDTO::getProgressPercentage)
                        .reduce(BigDecimal.ZERO, BigDecimal::add)
                        .divide(BigDecimal.valueOf(progress.size()), 2, RoundingMode.HALF_UP);
        return GoalProgressSummaryDTO.builder()
                .totalGoals(progress.size())
                .onTrack(onTrack)
                .completed(completed)
                .averageProgress(average)
                .build();
    }

    private List<Evaluation> runPass(UUID userId) {
        return ConflictRetry.withRetry("Progress pass", userId, () -> dataAccess.inUserTransaction(userId, () -> {
            LocalDate today = LocalDate.now(clock);
            Instant now = clock.instant();
            List<Evaluation> evaluations = new ArrayList<>();
            List<ProgressNotificationDTO> emitted = new ArrayList<>();
            for (Goal goal : dataAccess.fetchGoalsForUser(userId)) {
                Evaluation evaluation = evaluate(goal, today, now);
                evaluations.add(evaluation);
                emitted.addAll(evaluation.notifications());
            }
            notificationSink.publish(userId, emitted);
            return evaluations;
        }));
    }

    private Evaluation evaluate(Goal goal, LocalDate today, Instant now) {
        BigDecimal rate = contributionRateProvider.observedMonthlyContribution(goal, today).orElse(null);
        GoalProgressDTO progress = calculator.calculate(goal, rate, today);
        progress.setRecommendations(recommendationPolicy.recommend(progress));

        NotifiedState previous = dataAccess.fetchLastNotifiedState(goal.getId());
        NotificationDecision decision = notificationPolicy.evaluate(progress, previous, now);
        if (!decision.nextState().sameAs(previous)) {
            dataAccess.recordNotifiedState(goal.getId(), decision.nextState());
        }
        return new Evaluation(progress, decision.notifications());
    }

    private Goal requireOwnedGoal(UUID userId, UUID goalId) {
        return dataAccess.fetchGoal(goalId)
                .filter(g -> userId.equals(g.getUserId()))
                .orElseThrow(() -> new GoalNotFoundException(goalId));
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private record Evaluation(GoalProgressDTO progress, List<ProgressNotificationDTO> notifications) {
    }
}
