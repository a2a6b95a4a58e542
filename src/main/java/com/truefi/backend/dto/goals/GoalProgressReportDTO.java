package com.truefi.backend.dto.goals;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalProgressReportDTO {

    private List<GoalProgressDTO> progress;
    private GoalProgressSummaryDTO summary;
    private List<ProgressNotificationDTO> notifications;
}
