package com.remit.matching.scoring;

import com.remit.matching.normalize.NormalizationPass;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Scores how trustworthy a match is, from the pass that produced it, how alike the two strings
 * look and whether the paid amount agrees with the invoice total.
 */
public class ConfidenceScorer {

    static final double EXACT_SIMILARITY_FLOOR = 0.95;
    static final double EXACT_DISSIMILAR_PENALTY = 0.90;
    static final double AMOUNT_MISMATCH_PENALTY = 0.70;

    private static final BigDecimal NO_MATCH_CONFIDENCE = new BigDecimal("0.20");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Confidence of a single match, clamped to [0, 1].
     *
     * @param pass the pass that produced the match
     * @param originalText the payment's invoice reference as printed
     * @param matchedInvoice the invoice number selected from the ledger
     * @param amountWithinTolerance whether the paid amount agrees with the invoice total
     */
    public BigDecimal score(NormalizationPass pass, String originalText, String matchedInvoice,
                            boolean amountWithinTolerance) {
        Objects.requireNonNull(pass, "pass");

        double confidence = pass.getBaseConfidence();
        double similarity = similarity(originalText, matchedInvoice);

        switch (pass) {
            case EXACT -> {
                // same key but visibly different strings, e.g. stray inner characters
                if (similarity < EXACT_SIMILARITY_FLOOR) {
                    confidence *= EXACT_DISSIMILAR_PENALTY;
                }
            }
            case RELAXED -> confidence *= 0.7 + 0.3 * similarity;
            case NUMERIC -> confidence *= 0.5 + 0.5 * similarity;
        }

        if (!amountWithinTolerance) {
            confidence *= AMOUNT_MISMATCH_PENALTY;
        }

        return BigDecimal.valueOf(Math.max(0.0, Math.min(1.0, confidence)));
    }

    /**
     * Jaccard index over the distinct lowercase characters of the two strings.
     * 1.0 for identical non-empty strings, 0.0 when either is empty.
     */
    public static double similarity(String first, String second) {
        if (first == null || second == null || first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<Integer> a = charSet(first);
        Set<Integer> b = charSet(second);

        Set<Integer> union = new HashSet<>(a);
        union.addAll(b);
        a.retainAll(b);

        return (double) a.size() / union.size();
    }

    private static Set<Integer> charSet(String value) {
        Set<Integer> chars = new HashSet<>();
        value.toLowerCase(Locale.ROOT).codePoints().forEach(chars::add);
        return chars;
    }

    /**
     * Confidence for a whole remittance.
     * The mean of the matched lines' confidence, scaled down by the share of lines that matched,
     * averaged with the extraction confidence when one is known.
     *
     * @param lineConfidences one entry per line, null for unmatched lines
     * @param extractionConfidence confidence reported by document extraction, may be null
     * @return a value in [0, 1] with four decimal places
     */
    public static BigDecimal overallConfidence(List<BigDecimal> lineConfidences, BigDecimal extractionConfidence) {
        BigDecimal sum = BigDecimal.ZERO;
        int matched = 0;
        for (BigDecimal c : lineConfidences) {
            if (c != null) {
                sum = sum.add(c);
                matched++;
            }
        }

        BigDecimal base;
        if (matched == 0) {
            base = NO_MATCH_CONFIDENCE;
        } else {
            BigDecimal average = sum.divide(BigDecimal.valueOf(matched), MathContext.DECIMAL64);
            BigDecimal matchRatio = BigDecimal.valueOf(matched)
                .divide(BigDecimal.valueOf(lineConfidences.size()), MathContext.DECIMAL64);
            base = average.multiply(matchRatio, MathContext.DECIMAL64);
        }

        BigDecimal overall = extractionConfidence == null
            ? base
            : base.add(extractionConfidence).divide(TWO, MathContext.DECIMAL64);

        return clamp(overall).setScale(4, RoundingMode.HALF_UP);
    }

    private static BigDecimal clamp(BigDecimal value) {
        if (value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value.compareTo(BigDecimal.ONE) > 0 ? BigDecimal.ONE : value;
    }
}
