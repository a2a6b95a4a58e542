package com.truefi.backend.dto.goals;

import java.time.Instant;

import com.truefi.backend.enums.NotificationKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressNotificationDTO {

    private String goalId;
    private NotificationKind kind;

    // threshold percentage for MILESTONE notifications, null otherwise
    private Integer milestone;

    private String message;
    private Instant createdAt;
}
