package com.truefi.backend.services.goals;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.truefi.backend.dto.goals.ProgressNotificationDTO;
import com.truefi.backend.entities.GoalNotification;
import com.truefi.backend.repositories.GoalNotificationRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Stores notifications in {@code goal_notifications}, where clients poll for them. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoalNotificationLog implements ProgressNotificationSink {

    private final GoalNotificationRepository goalNotificationRepository;

    @Override
    @Transactional
    public void publish(UUID userId, List<ProgressNotificationDTO> notifications) {
        if (notifications.isEmpty()) {
            return;
        }
        List<GoalNotification> rows = notifications.stream()
                .map(n -> GoalNotification.builder()
                        .userId(userId)
                        .goalId(UUID.fromString(n.getGoalId()))
                        .kind(n.getKind())
                        .milestone(n.getMilestone())
                        .message(n.getMessage())
                        .createdAt(n.getCreatedAt())
                        .acknowledged(false)
                        .build())
                .toList();
        goalNotificationRepository.saveAll(rows);
        log.info("Stored {} goal notification(s) for user {}", rows.size(), userId);
    }

    @Transactional(readOnly = true)
    public List<ProgressNotificationDTO> recentFor(UUID userId) {
        return goalNotificationRepository.findTop50ByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(n -> ProgressNotificationDTO.builder()
                        .goalId(n.getGoalId().toString())
                        .kind(n.getKind())
                        .milestone(n.getMilestone())
                        .message(n.getMessage())
                        .createdAt(n.getCreatedAt())
                        .build())
                .toList();
    }
}
