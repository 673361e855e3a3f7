package com.exhibition.ledger.rules;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Canonicalizes a single cell value.
 *
 * <p>Rules, applied in order until the value stops changing:</p>
 * <ol>
 *   <li>null and null-like sentinels ({@code nan}, {@code None}, {@code NaT}, {@code null},
 *       case-insensitive) become the empty string</li>
 *   <li>surrounding whitespace is trimmed</li>
 *   <li>a leading {@code =} is stripped (an escaped formula, never evaluated)</li>
 *   <li>a value starting with {@code #} becomes empty (a propagated spreadsheet error)</li>
 *   <li>Persian and Arabic-Indic decimal digits become ASCII digits</li>
 * </ol>
 *
 * <p>{@link #normalize(Object)} is total and idempotent.</p>
 */
public final class ValueNormalizer {

    private static final Set<String> NULL_SENTINELS = Set.of("nan", "none", "nat", "null");

    private static final char PERSIAN_ZERO = '۰';
    private static final char ARABIC_INDIC_ZERO = '٠';

    private ValueNormalizer() {
        // Utility class
    }

    /**
     * Normalizes an arbitrary cell value. Numbers with no fractional part are rendered
     * without a decimal point, so a phone number read as {@code 2188776655.0} stays digits.
     */
    public static String normalize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return "";
            }
            return normalize(renderNumber(BigDecimal.valueOf(d)));
        }
        if (value instanceof Float f) {
            if (f.isNaN() || f.isInfinite()) {
                return "";
            }
            return normalize(renderNumber(new BigDecimal(f.toString())));
        }
        if (value instanceof BigDecimal bd) {
            return normalize(renderNumber(bd));
        }
        return normalize(value.toString());
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String current = value;
        String previous;
        do {
            previous = current;
            current = applyOnce(current);
        } while (!current.equals(previous));
        return current;
    }

    /**
     * True when the value normalizes to the empty string.
     */
    public static boolean isBlank(Object value) {
        return normalize(value).isEmpty();
    }

    public static boolean isNullSentinel(String value) {
        return value != null && NULL_SENTINELS.contains(value.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Converts Persian ({@code U+06F0..U+06F9}) and Arabic-Indic ({@code U+0660..U+0669})
     * digits to ASCII.
     */
    public static String toAsciiDigits(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            char mapped = c;
            if (c >= PERSIAN_ZERO && c <= PERSIAN_ZERO + 9) {
                mapped = (char) ('0' + (c - PERSIAN_ZERO));
            } else if (c >= ARABIC_INDIC_ZERO && c <= ARABIC_INDIC_ZERO + 9) {
                mapped = (char) ('0' + (c - ARABIC_INDIC_ZERO));
            }
            if (mapped != c && sb == null) {
                sb = new StringBuilder(value.length());
                sb.append(value, 0, i);
            }
            if (sb != null) {
                sb.append(mapped);
            }
        }
        return sb != null ? sb.toString() : value;
    }

    private static String applyOnce(String value) {
        if (isNullSentinel(value)) {
            return "";
        }
        String result = value.strip();
        if (result.startsWith("=")) {
            result = result.substring(1);
        }
        if (result.startsWith("#")) {
            return "";
        }
        return toAsciiDigits(result);
    }

    private static String renderNumber(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigInteger().toString();
        }
        return stripped.toPlainString();
    }
}
