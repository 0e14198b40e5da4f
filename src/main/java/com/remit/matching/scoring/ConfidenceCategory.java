package com.remit.matching.scoring;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Human-readable bands of match confidence.
 */
public enum ConfidenceCategory {
    VERY_HIGH(new BigDecimal("0.90")),
    HIGH(new BigDecimal("0.75")),
    MEDIUM(new BigDecimal("0.50")),
    LOW(new BigDecimal("0.30")),
    VERY_LOW(BigDecimal.ZERO);

    private final BigDecimal lowerBound;

    ConfidenceCategory(BigDecimal lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static ConfidenceCategory of(BigDecimal confidence) {
        if (confidence == null) {
            return VERY_LOW;
        }
        for (ConfidenceCategory category : values()) {
            if (confidence.compareTo(category.lowerBound) >= 0) {
                return category;
            }
        }
        return VERY_LOW;
    }

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
