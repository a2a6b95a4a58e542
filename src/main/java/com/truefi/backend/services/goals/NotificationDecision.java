package com.truefi.backend.services.goals;

import java.util.List;

import com.truefi.backend.dto.goals.ProgressNotificationDTO;
import com.truefi.backend.services.access.NotifiedState;

/** Notifications to emit for one goal, and the bookkeeping to store afterwards. */
public record NotificationDecision(List<ProgressNotificationDTO> notifications, NotifiedState nextState) {
}
