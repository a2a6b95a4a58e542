package com.truefi.backend.services.income;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text normalization for bank descriptions.
 * "ACME Corp PAYROLL PPD ID: 99812" and "Acme Corp Payroll 0412" share the key "acme corp payroll".
 */
public final class DescriptionNormalizer {

    private static final Pattern MARKS = Pattern.compile("\\p{M}");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern MULTISPACE = Pattern.compile("\\s+");

    // ACH/bank boilerplate that differs between postings of the same payer
    private static final Set<String> NOISE_TOKENS = Set.of(
            "ppd", "ccd", "web", "id", "ach", "co", "entry", "descr", "des", "indn", "trn", "ref", "www", "com"
    );

    private DescriptionNormalizer() {
    }

    /** Lowercase, accents stripped, punctuation collapsed to single spaces. */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String s = Normalizer.normalize(value, Normalizer.Form.NFD);
        s = MARKS.matcher(s).replaceAll("").toLowerCase(Locale.ROOT);
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        return MULTISPACE.matcher(s).replaceAll(" ").trim();
    }

    /** Grouping key: normalized text without digits and ACH noise tokens. */
    public static String key(String value) {
        String s = DIGITS.matcher(normalize(value)).replaceAll(" ");
        return Arrays.stream(MULTISPACE.split(s.trim()))
                .filter(t -> t.length() > 1)
                .filter(t -> !NOISE_TOKENS.contains(t))
                .collect(Collectors.joining(" "));
    }

    public static boolean containsAny(String normalizedText, Iterable<String> keywords) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return false;
        }
        for (String keyword : keywords) {
            String k = normalize(keyword);
            if (!k.isEmpty() && normalizedText.contains(k)) {
                return true;
            }
        }
        return false;
    }
}
