package com.truefi.backend.exceptions;

import java.util.UUID;

/**
 * Raised both for missing goals and for goals owned by another user, so callers cannot probe
 * for foreign goal ids.
 */
public class GoalNotFoundException extends ResourceNotFoundException {

    private final UUID goalId;

    public GoalNotFoundException(UUID goalId) {
        super("Goal not found: " + goalId);
        this.goalId = goalId;
    }

    public UUID getGoalId() {
        return goalId;
    }
}
