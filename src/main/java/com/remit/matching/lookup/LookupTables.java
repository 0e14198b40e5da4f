package com.remit.matching.lookup;

import com.remit.matching.normalize.NormalizationPass;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One lookup table per normalization pass, built from the same ledger snapshot.
 */
public final class LookupTables {

    private final Map<NormalizationPass, LookupTable> tables;

    public LookupTables(Map<NormalizationPass, LookupTable> tables) {
        EnumMap<NormalizationPass, LookupTable> copy = new EnumMap<>(NormalizationPass.class);
        for (NormalizationPass pass : NormalizationPass.values()) {
            LookupTable table = tables.get(pass);
            if (table == null) {
                throw new IllegalArgumentException("Missing lookup table for pass " + pass.getLabel());
            }
            if (table.getPass() != pass) {
                throw new IllegalArgumentException("Table for " + table.getPass().getLabel() +
                        " registered under " + pass.getLabel());
            }
            copy.put(pass, table);
        }
        this.tables = Collections.unmodifiableMap(copy);
    }

    public static LookupTables empty() {
        EnumMap<NormalizationPass, LookupTable> empty = new EnumMap<>(NormalizationPass.class);
        for (NormalizationPass pass : NormalizationPass.values()) {
            empty.put(pass, LookupTable.empty(pass));
        }
        return new LookupTables(empty);
    }

    public LookupTable get(NormalizationPass pass) {
        return tables.get(pass);
    }

    /** Total number of keys across all passes. */
    public int totalKeys() {
        return tables.values().stream().mapToInt(LookupTable::size).sum();
    }

    @Override
    public String toString() {
        return "LookupTables" + tables.values();
    }
}
