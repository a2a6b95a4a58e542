package com.truefi.backend.services.income;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.truefi.backend.entities.Transaction;
import com.truefi.backend.enums.Cadence;
import com.truefi.backend.services.stats.SeriesStats;

/**
 * A group of two or more deposits attributed to the same payer with compatible amounts,
 * ordered by posting date. Immutable once built.
 */
public final class RecurringSeries {

    public static final int MIN_MEMBERS = 2;

    private final List<Transaction> members;
    private final BigDecimal representativeAmount;
    private final Cadence cadence;

    private RecurringSeries(List<Transaction> members, BigDecimal representativeAmount, Cadence cadence) {
        this.members = members;
        this.representativeAmount = representativeAmount;
        this.cadence = cadence;
    }

    public static RecurringSeries of(List<Transaction> members, CadenceClassifier classifier) {
        Objects.requireNonNull(members, "members");
        if (members.size() < MIN_MEMBERS) {
            throw new IllegalArgumentException("A recurring series needs at least " + MIN_MEMBERS + " deposits");
        }
        List<Transaction> ordered = members.stream()
                .sorted(Comparator.comparing(Transaction::getPostedDate))
                .toList();
        BigDecimal median = SeriesStats.median(ordered.stream().map(Transaction::getAmount).toList());
        Cadence cadence = classifier.classify(ordered.stream().map(Transaction::getPostedDate).toList());
        return new RecurringSeries(ordered, median, cadence);
    }

    public List<Transaction> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public Cadence cadence() {
        return cadence;
    }

    /** Median member amount. */
    public BigDecimal representativeAmount() {
        return representativeAmount;
    }

    public List<BigDecimal> amounts() {
        return members.stream().map(Transaction::getAmount).toList();
    }

    /** Days between consecutive deposits, one fewer than the members. */
    public List<Integer> intervalsDays() {
        return SeriesStats.gapsInDays(members.stream().map(Transaction::getPostedDate).toList());
    }

    /** Display name of the most recent deposit. */
    public String name() {
        return members.get(members.size() - 1).displayName();
    }

    public String sampleDescription() {
        return Objects.toString(members.get(members.size() - 1).getRawDescription(), "");
    }

    public LocalDate firstDate() {
        return members.get(0).getPostedDate();
    }

    public LocalDate lastDate() {
        return members.get(members.size() - 1).getPostedDate();
    }
}
