package com.truefi.backend.enums;

public enum GoalPriority {
    HIGH,
    MEDIUM,
    LOW
}
