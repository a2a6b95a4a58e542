package com.truefi.backend.enums;

public enum GoalFundingSource {
    ACCOUNTS,
    PRIMARY_INCOME,
    MANUAL
}
