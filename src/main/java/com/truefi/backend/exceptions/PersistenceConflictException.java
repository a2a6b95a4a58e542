package com.truefi.backend.exceptions;

import java.util.UUID;

/**
 * A concurrent writer touched the same user's records. The whole read-decide-write operation
 * should be retried.
 */
public class PersistenceConflictException extends ConflictException {

    private final UUID userId;

    public PersistenceConflictException(UUID userId, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
