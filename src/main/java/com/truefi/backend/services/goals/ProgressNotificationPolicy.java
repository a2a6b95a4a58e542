package com.truefi.backend.services.goals;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.GoalTrackingProperties;
import com.truefi.backend.dto.goals.GoalProgressDTO;
import com.truefi.backend.dto.goals.ProgressNotificationDTO;
import com.truefi.backend.enums.NotificationKind;
import com.truefi.backend.services.access.NotifiedState;

import lombok.RequiredArgsConstructor;

/**
 * Decides which notifications a progress evaluation produces, given what was already notified.
 *
 * <ul>
 *   <li>MILESTONE: one per evaluation, for the highest threshold crossed since the high-water mark.</li>
 *   <li>COMPLETED: once per goal, at 100% or more.</li>
 *   <li>OFF_TRACK: on the transition from on track to off track. An unknown previous flag counts as on track.</li>
 * </ul>
 *
 * Evaluating the same progress twice yields nothing the second time.
 */
@RequiredArgsConstructor
@Component
public class ProgressNotificationPolicy {

    private static final BigDecimal COMPLETE = BigDecimal.valueOf(100);

    private final GoalTrackingProperties props;

    public NotificationDecision evaluate(GoalProgressDTO progress, NotifiedState previous, Instant now) {
        NotifiedState prior = previous != null ? previous : NotifiedState.initial();
        if (!progress.isValidTarget()) {
            return new NotificationDecision(List.of(), prior);
        }

        BigDecimal previousPct = prior.lastPercentage() != null ? prior.lastPercentage() : BigDecimal.ZERO;
        BigDecimal currentPct = progress.getProgressPercentage();
        List<ProgressNotificationDTO> out = new ArrayList<>();

        Integer crossed = null;
        for (Integer milestone : props.milestones()) {
            BigDecimal threshold = BigDecimal.valueOf(milestone);
            if (previousPct.compareTo(threshold) < 0 && currentPct.compareTo(threshold) >= 0) {
                crossed = milestone;
            }
        }
        if (crossed != null) {
            out.add(notification(progress, NotificationKind.MILESTONE, crossed,
                    progress.getName() + " reached " + crossed + "% of its target", now));
        }

        boolean complete = currentPct.compareTo(COMPLETE) >= 0;
        if (complete && !prior.completionNotified()) {
            out.add(notification(progress, NotificationKind.COMPLETED, null,
                    progress.getName() + " is fully funded", now));
        }

        boolean wasOnTrack = prior.lastOnTrack() == null || prior.lastOnTrack();
        if (wasOnTrack && !progress.isOnTrack() && !complete) {
            out.add(notification(progress, NotificationKind.OFF_TRACK, null, offTrackMessage(progress), now));
        }

        BigDecimal highWater = prior.lastPercentage() == null || currentPct.compareTo(prior.lastPercentage()) > 0
                ? currentPct
                : prior.lastPercentage();
        NotifiedState next = new NotifiedState(highWater, progress.isOnTrack(),
                prior.completionNotified() || complete);
        return new NotificationDecision(List.copyOf(out), next);
    }

    private static String offTrackMessage(GoalProgressDTO progress) {
        if (progress.getRequiredMonthlyContribution() == null) {
            return progress.getName() + " is behind schedule";
        }
        return progress.getName() + " is behind schedule: " + progress.getRequiredMonthlyContribution()
                + " per month is needed to reach it by " + progress.getTargetDate();
    }

    private static ProgressNotificationDTO notification(GoalProgressDTO progress, NotificationKind kind,
                                                        Integer milestone, String message, Instant now) {
        return ProgressNotificationDTO.builder()
                .goalId(progress.getGoalId())
                .kind(kind)
                .milestone(milestone)
                .message(message)
                .createdAt(now)
                .build();
    }
}
