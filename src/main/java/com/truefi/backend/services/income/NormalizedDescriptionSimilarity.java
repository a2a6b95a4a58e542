package com.truefi.backend.services.income;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.truefi.backend.entities.Transaction;

/** Equal keys score 1.0, containment 0.9, anything else token Jaccard. */
@Component
public class NormalizedDescriptionSimilarity implements MerchantSimilarity {

    static final double CONTAINMENT_SCORE = 0.9;

    @Override
    public double similarity(Transaction first, Transaction second) {
        String a = DescriptionNormalizer.key(first.displayName());
        String b = DescriptionNormalizer.key(second.displayName());
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.contains(b) || b.contains(a)) {
            return CONTAINMENT_SCORE;
        }
        return jaccard(tokens(a), tokens(b));
    }

    private static Set<String> tokens(String key) {
        return new HashSet<>(Arrays.asList(key.split(" ")));
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return (double) intersection.size() / union.size();
    }
}
