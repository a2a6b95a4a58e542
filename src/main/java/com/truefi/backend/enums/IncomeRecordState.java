package com.truefi.backend.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a user's recurring income.
 *
 * UNDETECTED and PENDING_CONFIRMATION are never persisted: they describe the outcome of a
 * detection run. CONFIRMED and SUPERSEDED are the states of a stored record.
 */
public enum IncomeRecordState {
    UNDETECTED,
    PENDING_CONFIRMATION,
    CONFIRMED,
    SUPERSEDED;

    public Set<IncomeRecordState> allowedTransitions() {
        return switch (this) {
            case UNDETECTED -> EnumSet.of(PENDING_CONFIRMATION, CONFIRMED);
            case PENDING_CONFIRMATION -> EnumSet.of(CONFIRMED, UNDETECTED);
            case CONFIRMED -> EnumSet.of(SUPERSEDED);
            case SUPERSEDED -> EnumSet.noneOf(IncomeRecordState.class);
        };
    }

    public boolean canTransitionTo(IncomeRecordState target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == SUPERSEDED;
    }
}
