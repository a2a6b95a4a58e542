package com.truefi.backend.controllers;

import com.truefi.backend.dto.ApiResponse;
import com.truefi.backend.dto.goals.GoalProgressActionRequestDTO;
import com.truefi.backend.dto.goals.GoalProgressDTO;
import com.truefi.backend.dto.goals.GoalProgressReportDTO;
import com.truefi.backend.dto.goals.ProgressNotificationDTO;
import com.truefi.backend.exceptions.BadRequestException;
import com.truefi.backend.services.goals.GoalNotificationLog;
import com.truefi.backend.services.goals.GoalProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/users/{userId}/goals")
@RequiredArgsConstructor
public class GoalProgressController {

    private final GoalProgressService goalProgressService;
    private final GoalNotificationLog goalNotificationLog;

    @GetMapping("/progress")
    public ResponseEntity<ApiResponse<?>> progress(
            @PathVariable UUID userId,
            @RequestParam(required = false) UUID goalId
    ) {
        if (goalId != null) {
            GoalProgressDTO dto = goalProgressService.trackGoalProgress(userId, goalId);
            return ResponseEntity.ok(ApiResponse.success(dto, "Goal progress retrieved"));
        }
        GoalProgressReportDTO report = goalProgressService.buildProgressReport(userId);
        return ResponseEntity.ok(ApiResponse.success(report, "Goal progress retrieved"));
    }

    @PostMapping("/progress")
    public ResponseEntity<ApiResponse<?>> act(
            @PathVariable UUID userId,
            @Valid @RequestBody GoalProgressActionRequestDTO dto
    ) {
        switch (dto.getAction()) {
            case SYNC_ACCOUNTS -> {
                goalProgressService.updateGoalProgressFromAccounts(userId);
                List<GoalProgressDTO> progress = goalProgressService.trackAllGoalsProgress(userId);
                return ResponseEntity.ok(ApiResponse.success(progress, "Goals synced from accounts"));
            }
            case MANUAL_UPDATE -> {
                if (dto.getGoalId() == null || dto.getAmount() == null) {
                    throw new BadRequestException("goalId and amount are required for MANUAL_UPDATE");
                }
                GoalProgressDTO progress = goalProgressService.updateGoalCurrentAmount(
                        userId, parseGoalId(dto.getGoalId()), dto.getAmount());
                return ResponseEntity.ok(ApiResponse.success(progress, "Goal updated"));
            }
            case CHECK_MILESTONES -> {
                List<ProgressNotificationDTO> notifications = goalProgressService.generateProgressNotifications(userId);
                return ResponseEntity.ok(ApiResponse.success(notifications,
                        notifications.size() + " notification(s) generated"));
            }
            default -> throw new BadRequestException("Unsupported action: " + dto.getAction());
        }
    }

    @GetMapping("/notifications")
    public ResponseEntity<ApiResponse<List<ProgressNotificationDTO>>> notifications(@PathVariable UUID userId) {
        List<ProgressNotificationDTO> list = goalNotificationLog.recentFor(userId);
        return ResponseEntity.ok(ApiResponse.success(list, "Notifications retrieved"));
    }

    private static UUID parseGoalId(String goalId) {
        try {
            return UUID.fromString(goalId);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid goalId: " + goalId);
        }
    }
}
