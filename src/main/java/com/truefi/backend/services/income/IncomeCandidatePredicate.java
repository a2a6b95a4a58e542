package com.truefi.backend.services.income;

import com.truefi.backend.entities.Transaction;

/**
 * Decides whether a settled inflow may be income at all. Implementations exclude transfers
 * between the user's own accounts; a smarter classifier can replace the keyword default.
 */
@FunctionalInterface
public interface IncomeCandidatePredicate {

    boolean isCandidate(Transaction transaction);
}
