package com.remit.matching.normalize;

import java.util.function.UnaryOperator;

/**
 * The three normalization passes, declared in priority order.
 * When more than one pass finds a match, the one declared first wins.
 */
public enum NormalizationPass {
    EXACT("exact", 0.95, Normalizer::exactNormalize),
    RELAXED("relaxed", 0.85, Normalizer::relaxedNormalize),
    NUMERIC("numeric", 0.70, Normalizer::numericNormalize);

    private final String label;
    private final double baseConfidence;
    private final UnaryOperator<String> normalizer;

    NormalizationPass(String label, double baseConfidence, UnaryOperator<String> normalizer) {
        this.label = label;
        this.baseConfidence = baseConfidence;
        this.normalizer = normalizer;
    }

    /**
     * Normalize the value under this pass.
     *
     * @param value raw invoice text
     * @return the key, or the empty string if the value yields no key
     */
    public String normalize(String value) {
        return normalizer.apply(value);
    }

    /**
     * Whether the key may be stored in or looked up from this pass's table.
     * Empty keys never qualify; numeric keys also need the minimum digit count.
     */
    public boolean isUsableKey(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        return this != NUMERIC || Normalizer.isUsableNumericKey(key);
    }

    /**
     * Normalize and apply the usability check in one step.
     *
     * @return the usable key, or {@code null} when the value produces none
     */
    public String keyFor(String value) {
        String key = normalize(value);
        return isUsableKey(key) ? key : null;
    }

    /**
     * @return true if this pass outranks the other one
     */
    public boolean outranks(NormalizationPass other) {
        return other == null || ordinal() < other.ordinal();
    }

    public String getLabel() {
        return label;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    /**
     * Parse a pass from its label, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown label
     */
    public static NormalizationPass fromLabel(String label) {
        for (NormalizationPass pass : values()) {
            if (pass.label.equalsIgnoreCase(label)) {
                return pass;
            }
        }
        throw new IllegalArgumentException("Unknown normalization pass: " + label);
    }
}
