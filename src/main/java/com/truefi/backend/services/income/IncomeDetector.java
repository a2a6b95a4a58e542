package com.truefi.backend.services.income;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.IncomeDetectionProperties;
import com.truefi.backend.dto.income.IncomeDetectionResult;
import com.truefi.backend.dto.income.RecurringDepositDTO;
import com.truefi.backend.entities.Transaction;
import com.truefi.backend.enums.Cadence;
import com.truefi.backend.exceptions.InvalidInputException;
import com.truefi.backend.services.stats.SeriesStats;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Estimates monthly income from a window of transactions.
 *
 * <p>Pure: no I/O, no clock, no shared state between calls. The same input always yields the
 * same result. Settled inflows that pass the {@link IncomeCandidatePredicate} are grouped into
 * series by payer similarity and amount tolerance, each series gets a cadence and a confidence,
 * and the highest monthly series among the confident, regular ones is reported.
 *
 * <p>Only the top series is reported, not a sum: two similar paychecks split into separate
 * series must not double count.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class IncomeDetector {

    private final IncomeDetectionProperties props;
    private final IncomeCandidatePredicate candidatePredicate;
    private final MerchantSimilarity merchantSimilarity;
    private final CadenceClassifier cadenceClassifier;
    private final SeriesConfidenceScorer confidenceScorer;

    /**
     * Single-currency detection.
     *
     * @throws InvalidInputException if a transaction lacks amount, date or currency, or income
     *         candidates are in more than one currency
     */
    public IncomeDetectionResult detectMonthlyIncome(List<Transaction> transactions) {
        return detectMonthlyIncome(transactions, null);
    }

    /**
     * Detection with candidate amounts converted to {@code conversionTable}'s base currency.
     * A {@code null} table behaves like {@link #detectMonthlyIncome(List)}.
     */
    public IncomeDetectionResult detectMonthlyIncome(List<Transaction> transactions,
                                                     CurrencyConversionTable conversionTable) {
        if (transactions == null) {
            throw new InvalidInputException("transactions must not be null");
        }
        transactions.forEach(IncomeDetector::validate);

        List<Transaction> candidates = transactions.stream()
                .filter(tx -> tx.getAmount().signum() > 0)
                .filter(tx -> !tx.isPending())
                .filter(candidatePredicate::isCandidate)
                .toList();
        if (candidates.isEmpty()) {
            return IncomeDetectionResult.noSignal();
        }

        candidates = inSingleCurrency(candidates, conversionTable);

        List<RecurringDepositDTO> deposits = new ArrayList<>();
        for (RecurringSeries series : findRecurringSeries(candidates)) {
            if (series.cadence() == Cadence.IRREGULAR) {
                continue;
            }
            int confidence = confidenceScorer.score(series);
            if (confidence < props.minimumConfidence()) {
                log.debug("Dropping series '{}' ({} deposits): confidence {} below {}",
                        series.name(), series.size(), confidence, props.minimumConfidence());
                continue;
            }
            deposits.add(toDeposit(series, confidence));
        }

        if (deposits.isEmpty()) {
            return IncomeDetectionResult.noSignal();
        }

        deposits.sort(Comparator
                .comparing(RecurringDepositDTO::getMonthlyAmount, Comparator.reverseOrder())
                .thenComparing(RecurringDepositDTO::getConfidence, Comparator.reverseOrder())
                .thenComparing(RecurringDepositDTO::getName));

        RecurringDepositDTO winner = deposits.get(0);
        return IncomeDetectionResult.builder()
                .monthlyIncome(winner.getMonthlyAmount())
                .confidence(winner.getConfidence())
                .source(IncomeDetectionResult.SOURCE_TRANSACTIONS)
                .details(new IncomeDetectionResult.Details(List.copyOf(deposits)))
                .build();
    }

    /**
     * Groups candidates into series of two or more deposits.
     *
     * <p>Transactions are visited in date order. Each joins the open series whose anchor it is
     * most similar to, provided similarity reaches the threshold and the amount is within
     * tolerance of the series median. A second deposit on a date the series already covers is
     * treated as a duplicate posting and ignored.
     */
    List<RecurringSeries> findRecurringSeries(List<Transaction> candidates) {
        List<Transaction> ordered = candidates.stream()
                .sorted(Comparator.comparing(Transaction::getPostedDate)
                        .thenComparing(tx -> String.valueOf(tx.getId())))
                .toList();

        List<SeriesBuilder> open = new ArrayList<>();
        for (Transaction tx : ordered) {
            SeriesBuilder best = null;
            double bestScore = -1.0;
            for (SeriesBuilder series : open) {
                if (!series.amountCompatible(tx.getAmount(), props.amountToleranceRatio())) {
                    continue;
                }
                double score = merchantSimilarity.similarity(series.anchor(), tx);
                if (score < props.similarityThreshold()) {
                    continue;
                }
                if (score > bestScore
                        || (score == bestScore && series.distanceTo(tx.getAmount()).compareTo(best.distanceTo(tx.getAmount())) < 0)) {
                    best = series;
                    bestScore = score;
                }
            }

            if (best == null) {
                open.add(new SeriesBuilder(tx));
            } else if (best.coversDate(tx)) {
                log.debug("Ignoring duplicate deposit {} on {}", tx.getId(), tx.getPostedDate());
            } else {
                best.add(tx);
            }
        }

        return open.stream()
                .filter(s -> s.members.size() >= RecurringSeries.MIN_MEMBERS)
                .map(s -> RecurringSeries.of(s.members, cadenceClassifier))
                .toList();
    }

    private static RecurringDepositDTO toDeposit(RecurringSeries series, int confidence) {
        BigDecimal amount = series.representativeAmount().setScale(2, RoundingMode.HALF_UP);
        BigDecimal monthly = series.representativeAmount()
                .multiply(series.cadence().getMonthlyFactor())
                .setScale(2, RoundingMode.HALF_UP);
        return RecurringDepositDTO.builder()
                .name(series.name())
                .amount(amount)
                .monthlyAmount(monthly)
                .frequency(series.cadence())
                .occurrences(series.size())
                .confidence(confidence)
                .firstDate(series.firstDate())
                .lastDate(series.lastDate())
                .build();
    }

    private static List<Transaction> inSingleCurrency(List<Transaction> candidates, CurrencyConversionTable table) {
        if (table != null) {
            return candidates.stream()
                    .map(tx -> converted(tx, table))
                    .toList();
        }
        Set<String> currencies = candidates.stream()
                .map(tx -> tx.getCurrency().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (currencies.size() > 1) {
            throw new InvalidInputException("Income candidates span several currencies " + currencies
                    + "; supply a conversion table");
        }
        return candidates;
    }

    private static Transaction converted(Transaction tx, CurrencyConversionTable table) {
        if (table.baseCurrency().equalsIgnoreCase(tx.getCurrency())) {
            return tx;
        }
        return Transaction.builder()
                .id(tx.getId())
                .userId(tx.getUserId())
                .accountId(tx.getAccountId())
                .amount(table.toBase(tx.getAmount(), tx.getCurrency()))
                .currency(table.baseCurrency())
                .postedDate(tx.getPostedDate())
                .merchantName(tx.getMerchantName())
                .rawDescription(tx.getRawDescription())
                .category(tx.getCategory())
                .pending(tx.isPending())
                .build();
    }

    private static void validate(Transaction tx) {
        if (tx == null) {
            throw new InvalidInputException("transaction must not be null");
        }
        if (tx.getAmount() == null) {
            throw new InvalidInputException("Transaction " + tx.getId() + " has no amount");
        }
        if (tx.getPostedDate() == null) {
            throw new InvalidInputException("Transaction " + tx.getId() + " has no posted date");
        }
        if (tx.getCurrency() == null || tx.getCurrency().isBlank()) {
            throw new InvalidInputException("Transaction " + tx.getId() + " has no currency");
        }
    }

    private static final class SeriesBuilder {

        private final Transaction anchor;
        private final List<Transaction> members = new ArrayList<>();
        private BigDecimal median;

        SeriesBuilder(Transaction first) {
            this.anchor = first;
            this.members.add(first);
            this.median = first.getAmount();
        }

        Transaction anchor() {
            return anchor;
        }

        void add(Transaction tx) {
            members.add(tx);
            median = SeriesStats.median(members.stream().map(Transaction::getAmount).toList());
        }

        boolean amountCompatible(BigDecimal amount, BigDecimal toleranceRatio) {
            return distanceTo(amount).compareTo(median.abs().multiply(toleranceRatio)) <= 0;
        }

        BigDecimal distanceTo(BigDecimal amount) {
            return amount.subtract(median).abs();
        }

        boolean coversDate(Transaction tx) {
            return members.stream().anyMatch(m -> m.getPostedDate().equals(tx.getPostedDate()));
        }
    }
}
