package com.truefi.backend.enums;

public enum NotificationKind {
    MILESTONE,
    OFF_TRACK,
    COMPLETED
}
