package com.remit.matching.normalize;

import java.util.Locale;

/**
 * String canonicalization strategies used to bridge formatting differences
 * between remittance text and ledger invoice numbers.
 *
 * <p>All methods are total: they never throw and accept {@code null},
 * which normalizes to the empty string. An empty result means "no key".
 */
public final class Normalizer {

    /** Numeric keys shorter than this collide too easily ("1", "07") to be trusted. */
    public static final int NUMERIC_MIN_DIGITS = 3;

    private Normalizer() {
    }

    /**
     * Trim surrounding whitespace and uppercase.
     *
     * @param value raw invoice text
     * @return the exact key, possibly empty
     */
    public static String exactNormalize(String value) {
        if (value == null) {
            return "";
        }
        return trim(value).toUpperCase(Locale.ROOT);
    }

    /**
     * Trim, drop every character that is not an ASCII letter or digit, then uppercase.
     * "Inv--39791" and "INV 39791" both become "INV39791".
     *
     * @param value raw invoice text
     * @return the relaxed key, possibly empty
     */
    public static String relaxedNormalize(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = trim(value);
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    /**
     * Concatenate the decimal digits of the value in their original order.
     *
     * @param value raw invoice text
     * @return the digit string, possibly empty or shorter than {@link #NUMERIC_MIN_DIGITS}
     */
    public static String numericNormalize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Remove leading and trailing whitespace, including no-break spaces such as U+00A0.
     */
    static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isBlankChar(value.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isBlankChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /**
     * Whether a numeric key is long enough to be inserted or probed.
     */
    public static boolean isUsableNumericKey(String key) {
        return key != null && key.length() >= NUMERIC_MIN_DIGITS;
    }
}
