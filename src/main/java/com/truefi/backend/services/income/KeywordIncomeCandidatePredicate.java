package com.truefi.backend.services.income;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.truefi.backend.config.IncomeDetectionProperties;
import com.truefi.backend.entities.Transaction;

/**
 * Keyword heuristics over category and description:
 * <ol>
 *   <li>categories equal to a known internal-transfer label are rejected;</li>
 *   <li>payroll-like keywords in category or description accept;</li>
 *   <li>uncategorized inflows are accepted from a minimum amount upwards.</li>
 * </ol>
 */
@Component
public class KeywordIncomeCandidatePredicate implements IncomeCandidatePredicate {

    private final IncomeDetectionProperties props;
    private final Set<String> internalTransferCategories;

    public KeywordIncomeCandidatePredicate(IncomeDetectionProperties props) {
        this.props = props;
        this.internalTransferCategories = props.internalTransferCategories().stream()
                .map(DescriptionNormalizer::normalize)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean isCandidate(Transaction transaction) {
        String category = DescriptionNormalizer.normalize(transaction.getCategory());
        if (internalTransferCategories.contains(category)) {
            return false;
        }

        String description = DescriptionNormalizer.normalize(
                Objects.toString(transaction.getMerchantName(), "") + " "
                        + Objects.toString(transaction.getRawDescription(), ""));
        if (DescriptionNormalizer.containsAny(category, props.incomeKeywords())
                || DescriptionNormalizer.containsAny(description, props.incomeKeywords())
                || DescriptionNormalizer.containsAny(description, props.payrollKeywords())) {
            return true;
        }

        BigDecimal amount = transaction.getAmount();
        return category.isEmpty()
                && amount != null
                && amount.compareTo(props.minimumUncategorizedAmount()) >= 0;
    }
}
