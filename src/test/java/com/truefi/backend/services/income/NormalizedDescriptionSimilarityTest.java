package com.truefi.backend.services.income;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.truefi.backend.entities.Transaction;

class NormalizedDescriptionSimilarityTest {

    private final NormalizedDescriptionSimilarity similarity = new NormalizedDescriptionSimilarity();

    @Test
    void achNoiseAndReferenceNumbers_areIgnored() {
        double score = similarity.similarity(
                tx("ACME CORP PAYROLL PPD ID: 1234567"),
                tx("Acme Corp Payroll 0412"));

        assertEquals(1.0, score, 1e-9);
    }

    @Test
    void accentsAndPunctuation_areIgnored() {
        assertEquals(1.0, similarity.similarity(tx("Café-Société Payroll"), tx("CAFE SOCIETE PAYROLL")), 1e-9);
    }

    @Test
    void containedKey_scoresContainment() {
        assertEquals(NormalizedDescriptionSimilarity.CONTAINMENT_SCORE,
                similarity.similarity(tx("ACME CORP"), tx("ACME CORP PAYROLL")), 1e-9);
    }

    @Test
    void partialOverlap_scoresTokenJaccard() {
        // {acme, payroll} shared out of {acme, corp, inc, payroll}
        assertEquals(0.5, similarity.similarity(tx("ACME CORP PAYROLL"), tx("ACME INC PAYROLL")), 1e-9);
    }

    @Test
    void unrelatedPayers_scoreZero() {
        assertEquals(0.0, similarity.similarity(tx("ACME CORP PAYROLL"), tx("STATE TAX REFUND")), 1e-9);
    }

    @Test
    void merchantName_takesPrecedenceOverRawDescription() {
        Transaction a = tx("POS CREDIT 88812");
        a.setMerchantName("Globex");
        Transaction b = tx("ACH CREDIT 11111");
        b.setMerchantName("Globex");

        assertEquals(1.0, similarity.similarity(a, b), 1e-9);
    }

    @Test
    void emptyDescription_scoresZero() {
        assertEquals(0.0, similarity.similarity(tx("12345"), tx("12345")), 1e-9);
    }

    private static Transaction tx(String rawDescription) {
        return Transaction.builder().rawDescription(rawDescription).build();
    }
}
