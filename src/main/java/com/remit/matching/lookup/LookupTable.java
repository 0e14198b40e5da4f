package com.remit.matching.lookup;

import com.remit.matching.normalize.NormalizationPass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable map from a pass's normalized key to every invoice number sharing that key,
 * in ledger order. Safe for any number of concurrent readers.
 */
public final class LookupTable {

    private final NormalizationPass pass;
    private final Map<String, List<String>> entries;
    private final int invoiceCount;

    LookupTable(NormalizationPass pass, Map<String, List<String>> entries, int invoiceCount) {
        this.pass = pass;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        entries.forEach((key, invoices) -> copy.put(key, List.copyOf(invoices)));
        this.entries = Collections.unmodifiableMap(copy);
        this.invoiceCount = invoiceCount;
    }

    /**
     * An empty table for the given pass.
     */
    public static LookupTable empty(NormalizationPass pass) {
        return new LookupTable(pass, Map.of(), 0);
    }

    /**
     * First invoice registered under the key, which is the earliest one in the ledger snapshot.
     */
    public Optional<String> first(String key) {
        List<String> invoices = entries.get(key);
        if (invoices == null || invoices.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(invoices.get(0));
    }

    /**
     * All invoices registered under the key, or an empty list.
     */
    public List<String> candidates(String key) {
        return entries.getOrDefault(key, List.of());
    }

    public NormalizationPass getPass() {
        return pass;
    }

    /** Number of distinct keys. */
    public int size() {
        return entries.size();
    }

    /** Number of invoices inserted, counting those sharing a key. */
    public int getInvoiceCount() {
        return invoiceCount;
    }

    /** Number of keys shared by more than one invoice. */
    public int getCollisionCount() {
        int collisions = 0;
        for (List<String> invoices : entries.values()) {
            if (invoices.size() > 1) {
                collisions++;
            }
        }
        return collisions;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, List<String>> asMap() {
        return entries;
    }

    @Override
    public String toString() {
        return "LookupTable{pass=" + pass.getLabel() +
                ", keys=" + entries.size() +
                ", invoices=" + invoiceCount +
                ", collisions=" + getCollisionCount() +
                '}';
    }
}
