package com.truefi.backend.enums;

public enum GoalProgressAction {
    SYNC_ACCOUNTS,
    MANUAL_UPDATE,
    CHECK_MILESTONES
}
