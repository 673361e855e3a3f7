package com.exhibition.ledger.reconcile;

import com.exhibition.ledger.rules.ValueNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds several cell values into one, keeping every distinct non-empty value
 * in first-seen order, separated by {@link #SEPARATOR}.
 *
 * <p>A value is skipped only when it already occurs verbatim, either as a collected
 * value or as one segment of a collected joined value. Every input value therefore
 * survives as a substring of the result.</p>
 */
public final class ValueJoiner {

    public static final String SEPARATOR = " | ";

    private ValueJoiner() {
        // Utility class
    }

    public static String join(List<String> values) {
        List<String> collected = new ArrayList<>();
        for (String raw : values) {
            String value = ValueNormalizer.normalize(raw);
            if (value.isEmpty() || contains(collected, value)) {
                continue;
            }
            collected.add(value);
        }
        return String.join(SEPARATOR, collected);
    }

    /**
     * Splits a joined value back into its segments.
     */
    public static List<String> segments(String joined) {
        List<String> parts = new ArrayList<>();
        if (joined == null || joined.isEmpty()) {
            return parts;
        }
        for (String part : joined.split(" \\| ", -1)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static boolean contains(List<String> collected, String value) {
        for (String existing : collected) {
            if (existing.equals(value) || segments(existing).contains(value)) {
                return true;
            }
        }
        return false;
    }
}
