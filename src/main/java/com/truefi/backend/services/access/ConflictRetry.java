package com.truefi.backend.services.access;

import java.util.UUID;
import java.util.function.Supplier;

import com.truefi.backend.exceptions.PersistenceConflictException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a read-decide-write unit for one user and repeats it once when a concurrent writer wins.
 * Each attempt must re-read what it depends on; a second conflict is surfaced to the caller.
 */
@Slf4j
public final class ConflictRetry {

    public static final int MAX_ATTEMPTS = 2;

    private ConflictRetry() {
    }

    public static <T> T withRetry(String operation, UUID userId, Supplier<T> attempt) {
        for (int i = 1; ; i++) {
            try {
                return attempt.get();
            } catch (PersistenceConflictException e) {
                if (i >= MAX_ATTEMPTS) {
                    log.error("Giving up on {} for user {} after {} attempts", operation, userId, i);
                    throw e;
                }
                log.warn("{} for user {} conflicted, retrying", operation, userId);
            }
        }
    }
}
