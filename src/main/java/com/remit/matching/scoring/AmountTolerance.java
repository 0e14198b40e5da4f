package com.remit.matching.scoring;

import com.remit.matching.match.PaymentLine;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether a payment line's amount agrees with the total of the invoice it matched.
 */
@FunctionalInterface
public interface AmountTolerance {

    BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    boolean isWithinTolerance(PaymentLine line, String matchedInvoice);

    /**
     * Totals are unknown, so every match is treated as disagreeing on amount.
     */
    static AmountTolerance unknownTotals() {
        return (line, invoice) -> false;
    }

    /**
     * Compare against a known total per invoice number. A missing total or a missing paid amount
     * counts as disagreement.
     *
     * @param totals invoice number to invoice total
     * @param tolerance maximum absolute difference that still counts as agreement
     */
    static AmountTolerance fromTotals(Map<String, BigDecimal> totals, BigDecimal tolerance) {
        Map<String, BigDecimal> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        return (line, invoice) -> withinTolerance(line.getPaidAmount(), snapshot.get(invoice), tolerance);
    }

    static AmountTolerance fromTotals(Map<String, BigDecimal> totals) {
        return fromTotals(totals, DEFAULT_TOLERANCE);
    }

    static boolean withinTolerance(BigDecimal paid, BigDecimal total, BigDecimal tolerance) {
        if (paid == null || total == null) {
            return false;
        }
        return paid.subtract(total).abs().compareTo(tolerance) <= 0;
    }
}
