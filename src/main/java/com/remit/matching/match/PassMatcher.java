package com.remit.matching.match;

import com.remit.matching.lookup.LookupTable;
import com.remit.matching.normalize.NormalizationPass;

import java.util.Optional;

/**
 * Probes one lookup table with one payment's text.
 */
public final class PassMatcher {

    private PassMatcher() {
    }

    /**
     * Normalize the text under the table's pass and return the first invoice registered under that key.
     * Never mutates the table.
     *
     * @param rawInvoiceText the payment's invoice reference
     * @param table the table to probe
     * @return the match, or empty when the key is unusable or absent
     */
    public static Optional<PassMatch> match(String rawInvoiceText, LookupTable table) {
        NormalizationPass pass = table.getPass();
        String key = pass.keyFor(rawInvoiceText);
        if (key == null) {
            return Optional.empty();
        }
        return table.first(key).map(invoice -> new PassMatch(pass, invoice));
    }
}
