package com.truefi.backend.services.access;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Notification bookkeeping for one goal. Both fields may be null for a goal that has never
 * been evaluated.
 *
 * @param lastPercentage     highest progress percentage already notified
 * @param lastOnTrack        on-track flag seen by the previous evaluation
 * @param completionNotified whether the COMPLETED notification was already emitted
 */
public record NotifiedState(BigDecimal lastPercentage, Boolean lastOnTrack, boolean completionNotified) {

    public static NotifiedState initial() {
        return new NotifiedState(null, null, false);
    }

    /** Equality that ignores BigDecimal scale, so 75.0 and 75.00 compare equal. */
    public boolean sameAs(NotifiedState other) {
        if (other == null) {
            return false;
        }
        boolean samePercentage = lastPercentage == null
                ? other.lastPercentage == null
                : other.lastPercentage != null && lastPercentage.compareTo(other.lastPercentage) == 0;
        return samePercentage
                && Objects.equals(lastOnTrack, other.lastOnTrack)
                && completionNotified == other.completionNotified;
    }
}
