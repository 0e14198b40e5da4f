package com.remit.matching.lookup;

import com.remit.matching.normalize.NormalizationPass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Accumulates invoice numbers under one pass's keys. Owned by a single thread
 * until {@link #build()} freezes it into a {@link LookupTable}.
 */
public class LookupTableBuilder {

    private final NormalizationPass pass;
    private final Map<String, List<String>> entries = new LinkedHashMap<>();
    private int invoiceCount;
    private int skipped;
    private boolean built;

    public LookupTableBuilder(NormalizationPass pass) {
        this.pass = Objects.requireNonNull(pass, "pass");
    }

    /**
     * Build the table for one pass from an ordered ledger snapshot.
     *
     * @param pass the normalization pass
     * @param invoiceNumbers invoice numbers in ledger order
     * @return the frozen table
     */
    public static LookupTable build(NormalizationPass pass, List<String> invoiceNumbers) {
        LookupTableBuilder builder = new LookupTableBuilder(pass);
        builder.addAll(invoiceNumbers);
        return builder.build();
    }

    /**
     * Register one invoice number. Numbers without a usable key under this pass are skipped.
     *
     * @return true if the number was inserted
     */
    public boolean add(String invoiceNumber) {
        if (built) {
            throw new IllegalStateException("Lookup table for " + pass.getLabel() + " already built");
        }
        String key = pass.keyFor(invoiceNumber);
        if (key == null) {
            skipped++;
            return false;
        }
        entries.computeIfAbsent(key, k -> new ArrayList<>()).add(invoiceNumber);
        invoiceCount++;
        return true;
    }

    public LookupTableBuilder addAll(List<String> invoiceNumbers) {
        for (String invoiceNumber : invoiceNumbers) {
            add(invoiceNumber);
        }
        return this;
    }

    public LookupTable build() {
        built = true;
        return new LookupTable(pass, entries, invoiceCount);
    }

    public int getSkipped() {
        return skipped;
    }
}
