package com.truefi.backend.services.income;

import com.truefi.backend.entities.Transaction;

/**
 * Scores how likely two transactions come from the same payer, from 0.0 (unrelated) to 1.0
 * (same payer). Kept apart from cadence and amount logic so matching strategies can be
 * swapped and tested on their own.
 */
public interface MerchantSimilarity {

    double similarity(Transaction first, Transaction second);
}
