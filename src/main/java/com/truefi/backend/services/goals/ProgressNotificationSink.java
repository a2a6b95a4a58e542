package com.truefi.backend.services.goals;

import java.util.List;
import java.util.UUID;

import com.truefi.backend.dto.goals.ProgressNotificationDTO;

/** Delivery channel for progress notifications. Called inside the user's transaction. */
public interface ProgressNotificationSink {

    void publish(UUID userId, List<ProgressNotificationDTO> notifications);
}
